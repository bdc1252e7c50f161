package in.mechmate.application.port.output;

import in.mechmate.domain.model.PushSubscription;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the notification_subscriptions table.
 */
public interface PushSubscriptionRepository {

    /**
     * All subscriptions, newest first.
     */
    List<PushSubscription> findAll();

    Optional<PushSubscription> findByEndpoint(String endpoint);

    PushSubscription create(String endpoint, String p256dhKey, String authKey, String userAgent);

    /**
     * Bump last_used_at to now.
     */
    void touch(long id);

    /**
     * @return true if a row was deleted
     */
    boolean deleteById(long id);

    /**
     * @return true if a row was deleted
     */
    boolean deleteByEndpoint(String endpoint);
}
