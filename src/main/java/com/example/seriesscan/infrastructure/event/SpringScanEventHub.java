package com.example.seriesscan.infrastructure.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Republishes scan notifications as Spring application events.
 */
@Component
public class SpringScanEventHub implements ScanEventHub {

    private static final Logger log = LoggerFactory.getLogger(SpringScanEventHub.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringScanEventHub(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(String eventName, Object payload) {
        try {
            applicationEventPublisher.publishEvent(new ScanNotification(eventName, payload));
        } catch (RuntimeException e) {
            log.debug("Scan notification dropped, event={} payload={}", eventName, payload, e);
        }
    }
}
