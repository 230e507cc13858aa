package com.copytrader.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/** Delivers alerts to {@code /topic/alerts} over the STOMP broker. */
@Component
public class WebSocketNotifier {

    private static final Logger log = LoggerFactory.getLogger(WebSocketNotifier.class);

    static final String ALERTS_TOPIC = "/topic/alerts";

    private final SimpMessagingTemplate simpMessagingTemplate;

    public WebSocketNotifier(SimpMessagingTemplate simpMessagingTemplate) {
        this.simpMessagingTemplate = simpMessagingTemplate;
    }

    public void send(Alert alert) {
        try {
            simpMessagingTemplate.convertAndSend(ALERTS_TOPIC, alert);
            log.debug("WebSocket alert sent: {}", alert.getTitle());
        } catch (Exception e) {
            log.error("Failed to send WebSocket alert: {}", e.getMessage());
        }
    }
}
