package com.copytrader.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors:
 * <ul>
 *   <li>eventExecutor -- {@code @Async} listeners (WebSocket push, alerts)</li>
 *   <li>replicationExecutor -- per-follower units of work fanned out from dispatch</li>
 *   <li>shortSaleExecutor -- borrow workflow workers, which may wait on symbol locks and locates</li>
 * </ul>
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${copytrader.async.core-pool-size}")
    private int corePoolSize;

    @Value("${copytrader.async.max-pool-size}")
    private int maxPoolSize;

    @Value("${copytrader.async.queue-capacity}")
    private int queueCapacity;

    @Value("${copytrader.replication.core-pool-size}")
    private int replicationCorePoolSize;

    @Value("${copytrader.replication.max-pool-size}")
    private int replicationMaxPoolSize;

    @Value("${copytrader.replication.queue-capacity}")
    private int replicationQueueCapacity;

    @Value("${copytrader.short-sale.pool-size}")
    private int shortSalePoolSize;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("replicationExecutor")
    public ThreadPoolTaskExecutor replicationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(replicationCorePoolSize);
        executor.setMaxPoolSize(replicationMaxPoolSize);
        executor.setQueueCapacity(replicationQueueCapacity);
        executor.setThreadNamePrefix("replicate-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /** Fixed size; workers blocked on the same symbol lock each hold a thread. */
    @Bean("shortSaleExecutor")
    public ThreadPoolTaskExecutor shortSaleExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(shortSalePoolSize);
        executor.setMaxPoolSize(shortSalePoolSize);
        executor.setThreadNamePrefix("short-sale-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
