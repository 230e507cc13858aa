package com.copytrader.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the master account it mirrors, so dashboards fed by several engine
 * instances can be split per master. Meters themselves live in CustomMetricsService.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> copytraderCommonTags(
            @Value("${copytrader.master.account-id}") String masterAccountId) {
        return registry -> registry.config()
                .commonTags("application", "copytrader", "master", masterAccountId)
                // follower order ids would explode cardinality
                .meterFilter(MeterFilter.ignoreTags("followerOrderId"));
    }
}
