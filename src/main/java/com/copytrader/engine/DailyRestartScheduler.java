package com.copytrader.engine;

import com.copytrader.domain.enums.EngineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily restart of a running engine at a fixed local time.
 *
 * <p>Sessions, tasks, queued actions and the in-memory order map are torn down and the engine
 * reconnects on its own. Followers, multipliers and the blacklist live in H2 and survive.
 * Replication resumes only after reconciliation has been applied or skipped again.
 */
@Component
public class DailyRestartScheduler {

    private static final Logger log = LoggerFactory.getLogger(DailyRestartScheduler.class);

    private final ReplicationEngine replicationEngine;
    private final boolean enabled;

    public DailyRestartScheduler(
            ReplicationEngine replicationEngine, @Value("${copytrader.restart.enabled}") boolean enabled) {
        this.replicationEngine = replicationEngine;
        this.enabled = enabled;
    }

    @Scheduled(cron = "${copytrader.restart.cron}", zone = "${copytrader.restart.zone}")
    public void restart() {
        if (!enabled) {
            log.debug("Scheduled restart disabled");
            return;
        }
        if (replicationEngine.getState() == EngineState.STOPPED) {
            log.info("Scheduled restart skipped, engine is STOPPED");
            return;
        }
        log.info("Scheduled restart starting");
        try {
            replicationEngine.restart("Scheduled daily restart");
        } catch (RuntimeException e) {
            log.error("Scheduled restart failed, engine left STOPPED", e);
        }
    }
}
