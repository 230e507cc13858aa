package com.copytrader.api.websocket;

import com.copytrader.domain.enums.NotificationKind;
import com.copytrader.domain.model.StatusNotification;
import com.copytrader.event.ReplicationStatusEvent;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Pushes every status notification to {@code /topic/updates}, typed by notification kind.
 * Runs on the event executor so a slow subscriber never holds up the engine.
 */
@Component
public class UpdatesHandler {

    private static final Logger log = LoggerFactory.getLogger(UpdatesHandler.class);

    static final String UPDATES_TOPIC = "/topic/updates";

    private final SimpMessagingTemplate simpMessagingTemplate;

    public UpdatesHandler(SimpMessagingTemplate simpMessagingTemplate) {
        this.simpMessagingTemplate = simpMessagingTemplate;
    }

    @Async("eventExecutor")
    @EventListener
    public void onReplicationStatus(ReplicationStatusEvent event) {
        StatusNotification notification = event.getNotification();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subjectId", notification.getSubjectId());
        payload.put("followerId", notification.getFollowerId());
        payload.put("symbol", notification.getSymbol());
        payload.put("status", notification.getStatus());
        if (notification.hasError()) {
            payload.put("error", notification.getError());
            payload.put(
                    "errorCategory",
                    notification.getErrorCategory() != null
                            ? notification.getErrorCategory().name()
                            : null);
        }
        payload.put("createdAt", notification.getCreatedAt());
        payload.put("updatedAt", notification.getUpdatedAt());
        if (!notification.getDetails().isEmpty()) {
            payload.put("details", notification.getDetails());
        }

        sendUpdate(notification.getKind(), payload);
    }

    private void sendUpdate(NotificationKind type, Object data) {
        try {
            simpMessagingTemplate.convertAndSend(UPDATES_TOPIC, WebSocketMessage.of(type, data));
        } catch (Exception e) {
            log.error("Failed to send {} update via WebSocket: {}", type, e.getMessage());
        }
    }
}
