package in.mechmate.domain.model;

import java.time.Instant;

/**
 * Browser push subscription registered by a client.
 */
public record PushSubscription(
        long id,
        String endpoint,
        String p256dhKey,
        String authKey,
        String userAgent,    // nullable
        Instant createdAt,
        Instant lastUsedAt) {
}
