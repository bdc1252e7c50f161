package in.mechmate.application.notification;

import in.mechmate.application.port.output.NotificationMetrics;
import in.mechmate.application.port.output.PushSubscriptionRepository;
import in.mechmate.application.port.output.PushTransport;
import in.mechmate.application.port.output.RepositoryException;
import in.mechmate.domain.model.NotificationPayload;
import in.mechmate.domain.model.PushResult;
import in.mechmate.domain.model.PushSubscription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationDeliveryServiceTest {

    private static final NotificationPayload PAYLOAD = NotificationPayload.of("Upcoming Maintenance", "Oil Change due for Truck today");

    @Mock
    private PushSubscriptionRepository subscriptionRepo;
    @Mock
    private PushTransport transport;
    @Mock
    private NotificationMetrics metrics;

    private NotificationDeliveryService service;

    @BeforeEach
    void setUp() {
        service = new NotificationDeliveryService(subscriptionRepo, transport, metrics);
    }

    @Test
    void broadcastNotification_countsOnlyAcceptedSends() {
        PushSubscription ok = subscription(1);
        PushSubscription gone = subscription(2);
        PushSubscription flaky = subscription(3);
        when(subscriptionRepo.findAll()).thenReturn(List.of(ok, gone, flaky));
        when(transport.isConfigured()).thenReturn(true);
        when(transport.send(eq(ok), anyString())).thenReturn(PushResult.delivered(201));
        when(transport.send(eq(gone), anyString())).thenReturn(PushResult.permanentlyInvalid(410, "Gone"));
        when(transport.send(eq(flaky), anyString())).thenReturn(PushResult.transientFailure(503, "Service Unavailable"));

        int sent = service.broadcastNotification(PAYLOAD);

        assertEquals(1, sent);
        verify(subscriptionRepo).touch(1);
        verify(subscriptionRepo).deleteById(2);
        verify(subscriptionRepo, never()).deleteById(3);
        verify(subscriptionRepo, never()).touch(3);
        verify(metrics).recordSubscriptionPruned();
        verify(metrics).recordPush(PushResult.Outcome.DELIVERED);
        verify(metrics).recordPush(PushResult.Outcome.PERMANENTLY_INVALID);
        verify(metrics).recordPush(PushResult.Outcome.TRANSIENT_FAILURE);
    }

    @Test
    void broadcastNotification_serializesWirePayload() {
        PushSubscription sub = subscription(1);
        when(subscriptionRepo.findAll()).thenReturn(List.of(sub));
        when(transport.isConfigured()).thenReturn(true);
        when(transport.send(eq(sub), anyString())).thenReturn(PushResult.delivered(201));

        service.broadcastNotification(PAYLOAD);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(transport).send(eq(sub), json.capture());
        assertEquals("{\"title\":\"Upcoming Maintenance\",\"body\":\"Oil Change due for Truck today\","
            + "\"icon\":\"/robot.png\",\"badge\":\"/robot.png\",\"data\":{\"url\":\"/\"}}", json.getValue());
    }

    @Test
    void broadcastNotification_noSubscriptions() {
        when(subscriptionRepo.findAll()).thenReturn(List.of());

        assertEquals(0, service.broadcastNotification(PAYLOAD));
        verifyNoInteractions(transport);
    }

    @Test
    void sendNotification_unconfiguredTransportNeverSends() {
        when(transport.isConfigured()).thenReturn(false);

        assertFalse(service.sendNotification(subscription(1), PAYLOAD));
        verify(transport, never()).send(any(), anyString());
        verifyNoInteractions(subscriptionRepo);
    }

    @Test
    void sendNotification_touchFailureStillCountsAsDelivered() {
        PushSubscription sub = subscription(1);
        when(transport.isConfigured()).thenReturn(true);
        when(transport.send(eq(sub), anyString())).thenReturn(PushResult.delivered(201));
        doThrow(new RepositoryException("db down", null)).when(subscriptionRepo).touch(1);

        assertTrue(service.sendNotification(sub, PAYLOAD));
    }

    @Test
    void sendNotification_pruneFailureIsNotPropagated() {
        PushSubscription sub = subscription(7);
        when(transport.isConfigured()).thenReturn(true);
        when(transport.send(eq(sub), anyString())).thenReturn(PushResult.permanentlyInvalid(404, "Not Found"));
        when(subscriptionRepo.deleteById(anyLong())).thenThrow(new RepositoryException("db down", null));

        assertFalse(service.sendNotification(sub, PAYLOAD));
        verify(metrics, never()).recordSubscriptionPruned();
    }

    @Test
    void sendNotification_transientFailureKeepsSubscription() {
        PushSubscription sub = subscription(1);
        when(transport.isConfigured()).thenReturn(true);
        when(transport.send(eq(sub), anyString())).thenReturn(PushResult.transientFailure(0, "timed out"));

        assertFalse(service.sendNotification(sub, PAYLOAD));
        verify(subscriptionRepo, never()).deleteById(anyLong());
        verify(subscriptionRepo, never()).touch(anyLong());
    }

    private static PushSubscription subscription(long id) {
        Instant created = Instant.parse("2026-01-01T00:00:00Z");
        return new PushSubscription(id, "https://push.example.com/" + id, "p256dh-" + id, "auth-" + id,
            "Mozilla/5.0", created, created);
    }
}
