package com.copytrader.domain.model;

import com.copytrader.domain.enums.ErrorCategory;
import com.copytrader.domain.enums.NotificationKind;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Payload pushed to observers on every task transition, replication outcome, queue change and
 * reconciliation alert. {@code subjectId} is the task id, master order id or action id the
 * notification is about.
 */
@Value
@Builder
public class StatusNotification {

    NotificationKind kind;
    String subjectId;
    String followerId;
    String symbol;
    String status;
    String error;
    ErrorCategory errorCategory;
    Instant createdAt;
    Instant updatedAt;

    @Builder.Default
    Map<String, Object> details = Map.of();

    public boolean hasError() {
        return error != null;
    }
}
