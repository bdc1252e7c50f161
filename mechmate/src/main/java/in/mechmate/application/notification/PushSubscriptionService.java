package in.mechmate.application.notification;

import in.mechmate.application.port.output.PushSubscriptionRepository;
import in.mechmate.domain.model.PushSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Client registration for push notifications.
 */
public final class PushSubscriptionService {
    private static final Logger log = LoggerFactory.getLogger(PushSubscriptionService.class);

    private final PushSubscriptionRepository subscriptionRepository;

    public PushSubscriptionService(PushSubscriptionRepository subscriptionRepository) {
        this.subscriptionRepository = subscriptionRepository;
    }

    /**
     * Register a browser subscription. Re-registering a known endpoint only
     * bumps its last_used_at.
     *
     * @throws IllegalArgumentException if endpoint or either key is missing
     */
    public PushSubscription subscribe(String endpoint, String p256dhKey, String authKey, String userAgent) {
        if (isBlank(endpoint) || isBlank(p256dhKey) || isBlank(authKey)) {
            throw new IllegalArgumentException("Invalid subscription data");
        }

        return subscriptionRepository.findByEndpoint(endpoint)
            .map(existing -> {
                subscriptionRepository.touch(existing.id());
                log.info("[PUSH] Subscription {} re-registered", existing.id());
                return existing;
            })
            .orElseGet(() -> subscriptionRepository.create(endpoint, p256dhKey, authKey, userAgent));
    }

    /**
     * @return true if a subscription with this endpoint existed
     * @throws IllegalArgumentException if endpoint is missing
     */
    public boolean unsubscribe(String endpoint) {
        if (isBlank(endpoint)) {
            throw new IllegalArgumentException("Endpoint is required");
        }
        return subscriptionRepository.deleteByEndpoint(endpoint);
    }

    /**
     * @return true if the subscription existed
     */
    public boolean delete(long subscriptionId) {
        return subscriptionRepository.deleteById(subscriptionId);
    }

    public List<PushSubscription> list() {
        return subscriptionRepository.findAll();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
