package com.copytrader.notification;

import com.copytrader.domain.enums.AlertSeverity;
import com.copytrader.domain.enums.ErrorCategory;
import com.copytrader.domain.enums.NotificationKind;
import com.copytrader.domain.model.StatusNotification;
import com.copytrader.event.ReplicationStatusEvent;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Turns alert-worthy status notifications into {@link Alert}s.
 *
 * <p>Alerts are raised for:
 * <ul>
 *   <li>rejection, capacity and connectivity failures</li>
 *   <li>a reconnected follower with queued actions waiting for a replay decision</li>
 *   <li>reconciliation entries where the follower holds the opposite direction</li>
 * </ul>
 * Cancellations and configuration skips (blacklist, disabled follower) never alert.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    public static final String OPPOSITE_DIRECTION_STATUS = "OPPOSITE_DIRECTION";

    private final WebSocketNotifier webSocketNotifier;

    public NotificationService(WebSocketNotifier webSocketNotifier) {
        this.webSocketNotifier = webSocketNotifier;
    }

    @Async("eventExecutor")
    @EventListener
    public void onReplicationStatus(ReplicationStatusEvent event) {
        toAlert(event.getNotification()).ifPresent(alert -> {
            log.info("Alert: {} - {}", alert.getTitle(), alert.getMessage());
            webSocketNotifier.send(alert);
        });
    }

    /** Maps a notification to an alert, or empty if it is not alert-worthy. */
    public Optional<Alert> toAlert(StatusNotification notification) {
        ErrorCategory category = notification.getErrorCategory();
        if (category != null && category.isAlerting()) {
            return Optional.of(Alert.builder()
                    .severity(category == ErrorCategory.CONNECTIVITY ? AlertSeverity.INFO : AlertSeverity.WARNING)
                    .category(category)
                    .title(titleFor(notification.getKind(), category))
                    .message(String.format(
                            "%s %s on %s: %s",
                            notification.getSymbol(),
                            notification.getStatus(),
                            notification.getFollowerId(),
                            notification.getError()))
                    .followerId(notification.getFollowerId())
                    .symbol(notification.getSymbol())
                    .build());
        }
        if (notification.getKind() == NotificationKind.QUEUED_ACTIONS_AVAILABLE) {
            return Optional.of(Alert.builder()
                    .severity(AlertSeverity.INFO)
                    .title("Follower reconnected")
                    .message(String.format(
                            "%s reconnected with %s queued action(s) awaiting replay",
                            notification.getFollowerId(),
                            notification.getDetails().getOrDefault("count", "?")))
                    .followerId(notification.getFollowerId())
                    .build());
        }
        if (notification.getKind() == NotificationKind.RECONCILIATION
                && OPPOSITE_DIRECTION_STATUS.equals(notification.getStatus())) {
            return Optional.of(Alert.builder()
                    .severity(AlertSeverity.WARNING)
                    .title("Opposite position")
                    .message(String.format(
                            "%s holds %s in the opposite direction to the master",
                            notification.getFollowerId(), notification.getSymbol()))
                    .followerId(notification.getFollowerId())
                    .symbol(notification.getSymbol())
                    .build());
        }
        return Optional.empty();
    }

    private String titleFor(NotificationKind kind, ErrorCategory category) {
        return switch (category) {
            case CAPACITY -> "Locate failed";
            case REJECTION -> kind == NotificationKind.SHORT_SALE_TASK ? "Short sale rejected" : "Order rejected";
            case CONNECTIVITY -> "Follower unreachable";
            default -> category.name();
        };
    }
}
