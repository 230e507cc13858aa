package com.copytrader.event;

import com.copytrader.domain.enums.EngineState;
import com.copytrader.domain.enums.NotificationKind;
import com.copytrader.domain.model.ReconciliationApplyResult;
import com.copytrader.domain.model.StatusNotification;
import java.time.Instant;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the application's
 * events. Delivery depends on the listener: synchronous {@code @EventListener} or
 * {@code @Async @EventListener} on the event executor.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Status ----

    public void publishStatus(Object source, StatusNotification notification) {
        applicationEventPublisher.publishEvent(new ReplicationStatusEvent(source, notification));
    }

    public void publishEngineState(Object source, EngineState previous, EngineState current, String reason) {
        Instant now = Instant.now();
        publishStatus(
                source,
                StatusNotification.builder()
                        .kind(NotificationKind.ENGINE_STATE)
                        .subjectId("engine")
                        .status(current.name())
                        .createdAt(now)
                        .updatedAt(now)
                        .details(Map.of("previous", previous.name(), "reason", reason))
                        .build());
    }

    // ---- Reconciliation ----

    public void publishReconciliationApplied(Object source, ReconciliationApplyResult result) {
        applicationEventPublisher.publishEvent(new ReconciliationEvent(source, result, false));
    }

    public void publishReconciliationSkipped(Object source) {
        applicationEventPublisher.publishEvent(new ReconciliationEvent(source, null, true));
    }
}
