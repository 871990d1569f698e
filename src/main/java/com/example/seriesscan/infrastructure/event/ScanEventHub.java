package com.example.seriesscan.infrastructure.event;

/**
 * Fire-and-forget publish target for scan notifications. Implementations must be thread-safe.
 */
public interface ScanEventHub {

    String NOTIFICATION_PROGRESS = "NotificationProgress";

    void publish(String eventName, Object payload);
}
