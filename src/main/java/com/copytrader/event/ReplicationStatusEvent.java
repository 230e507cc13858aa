package com.copytrader.event;

import com.copytrader.domain.model.StatusNotification;
import org.springframework.context.ApplicationEvent;

/**
 * Carries a {@link StatusNotification} from the engine to observers.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>UpdatesHandler -- pushes every notification on {@code /topic/updates}</li>
 *   <li>NotificationService -- raises alerts for rejection, capacity and connectivity failures</li>
 *   <li>CustomMetricsService -- counts replication outcomes and task terminal states</li>
 * </ul>
 */
public class ReplicationStatusEvent extends ApplicationEvent {

    private final StatusNotification notification;

    public ReplicationStatusEvent(Object source, StatusNotification notification) {
        super(source);
        this.notification = notification;
    }

    public StatusNotification getNotification() {
        return notification;
    }
}
