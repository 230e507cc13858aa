package com.copytrader.notification;

import com.copytrader.domain.model.StatusNotification;

/**
 * Outbound boundary for engine status. Invoked on every short-sale task transition, every
 * replication outcome, every queued or replayed action and every reconciliation alert.
 * Implementations must not throw into the caller.
 */
public interface StatusNotificationSink {

    void publish(StatusNotification notification);
}
