package com.copytrader.notification;

import com.copytrader.domain.enums.AlertSeverity;
import com.copytrader.domain.enums.ErrorCategory;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/** Alert pushed on {@code /topic/alerts}, derived from a status notification. */
@Data
@Builder
public class Alert {

    private AlertSeverity severity;
    private ErrorCategory category;
    private String title;
    private String message;
    private String followerId;
    private String symbol;

    @Builder.Default
    private Instant timestamp = Instant.now();
}
