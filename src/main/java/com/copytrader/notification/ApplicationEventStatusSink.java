package com.copytrader.notification;

import com.copytrader.domain.model.StatusNotification;
import com.copytrader.event.EventPublisherHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Sink that republishes notifications as {@link com.copytrader.event.ReplicationStatusEvent}s. */
@Component
public class ApplicationEventStatusSink implements StatusNotificationSink {

    private static final Logger log = LoggerFactory.getLogger(ApplicationEventStatusSink.class);

    private final EventPublisherHelper eventPublisherHelper;

    public ApplicationEventStatusSink(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void publish(StatusNotification notification) {
        try {
            eventPublisherHelper.publishStatus(this, notification);
        } catch (RuntimeException e) {
            log.error(
                    "Failed to publish status notification: kind={}, subject={}, status={}",
                    notification.getKind(),
                    notification.getSubjectId(),
                    notification.getStatus(),
                    e);
        }
    }
}
