package com.copytrader.api.websocket;

import com.copytrader.domain.enums.NotificationKind;
import java.time.Instant;
import lombok.Value;

/**
 * Frame pushed on {@code /topic/updates}. Clients switch on {@code type}; {@code sentAt} lets a
 * dashboard drop frames older than the snapshot it loaded over REST.
 */
@Value
public class WebSocketMessage {

    NotificationKind type;
    Object data;
    Instant sentAt;

    public static WebSocketMessage of(NotificationKind type, Object data) {
        return new WebSocketMessage(type, data, Instant.now());
    }
}
