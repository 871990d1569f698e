package com.example.seriesscan.infrastructure.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.example.seriesscan.domain.enumtype.ProgressEventType;
import com.example.seriesscan.domain.model.ScanProgressEvent;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

class SpringScanEventHubTest {

    @Test
    void publishShouldWrapPayloadInNotification() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        SpringScanEventHub hub = new SpringScanEventHub(publisher);
        ScanProgressEvent payload = new ScanProgressEvent("/lib/a.cbz", "Manga", ProgressEventType.UPDATED);

        hub.publish(ScanEventHub.NOTIFICATION_PROGRESS, payload);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publishEvent(captor.capture());
        ScanNotification notification = (ScanNotification) captor.getValue();
        assertEquals("NotificationProgress", notification.getEventName());
        assertSame(payload, notification.getPayload());
    }

    @Test
    void publishShouldNotPropagateListenerFailures() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        doThrow(new IllegalStateException("listener failed")).when(publisher).publishEvent(any(Object.class));

        new SpringScanEventHub(publisher).publish(ScanEventHub.NOTIFICATION_PROGRESS, "payload");
    }
}
