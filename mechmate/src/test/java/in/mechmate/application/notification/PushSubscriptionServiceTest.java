package in.mechmate.application.notification;

import in.mechmate.application.port.output.InMemoryPushSubscriptionRepository;
import in.mechmate.domain.model.PushSubscription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class PushSubscriptionServiceTest {

    private static final String ENDPOINT = "https://fcm.googleapis.com/fcm/send/abc123";

    private MutableClock clock;
    private InMemoryPushSubscriptionRepository repo;
    private PushSubscriptionService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-10T09:00:00Z"));
        repo = new InMemoryPushSubscriptionRepository(clock);
        service = new PushSubscriptionService(repo);
    }

    @Test
    void subscribe_createsNewSubscription() {
        PushSubscription sub = service.subscribe(ENDPOINT, "p256dh", "auth", "Mozilla/5.0");

        assertEquals(ENDPOINT, sub.endpoint());
        assertEquals("Mozilla/5.0", sub.userAgent());
        assertEquals(1, service.list().size());
    }

    @Test
    void subscribe_existingEndpointIsTouchedNotDuplicated() {
        PushSubscription first = service.subscribe(ENDPOINT, "p256dh", "auth", null);
        clock.advanceTo(Instant.parse("2026-03-11T09:00:00Z"));

        PushSubscription again = service.subscribe(ENDPOINT, "p256dh", "auth", null);

        assertEquals(first.id(), again.id());
        assertEquals(1, service.list().size());
        assertEquals(Instant.parse("2026-03-11T09:00:00Z"), repo.findByEndpoint(ENDPOINT).orElseThrow().lastUsedAt());
    }

    @Test
    void subscribe_rejectsMissingFields() {
        assertThrows(IllegalArgumentException.class, () -> service.subscribe(null, "p256dh", "auth", null));
        assertThrows(IllegalArgumentException.class, () -> service.subscribe(ENDPOINT, "", "auth", null));
        assertThrows(IllegalArgumentException.class, () -> service.subscribe(ENDPOINT, "p256dh", null, null));
        assertTrue(service.list().isEmpty());
    }

    @Test
    void unsubscribe_byEndpoint() {
        service.subscribe(ENDPOINT, "p256dh", "auth", null);

        assertTrue(service.unsubscribe(ENDPOINT));
        assertFalse(service.unsubscribe(ENDPOINT));
        assertThrows(IllegalArgumentException.class, () -> service.unsubscribe(" "));
    }

    @Test
    void delete_byId() {
        PushSubscription sub = service.subscribe(ENDPOINT, "p256dh", "auth", null);

        assertTrue(service.delete(sub.id()));
        assertFalse(service.delete(sub.id()));
    }

    @Test
    void list_newestFirst() {
        service.subscribe(ENDPOINT, "p256dh", "auth", null);
        PushSubscription newer = service.subscribe(ENDPOINT + "-2", "p256dh", "auth", null);

        assertEquals(newer.id(), service.list().get(0).id());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advanceTo(Instant instant) {
            this.now = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
