package in.mechmate.application.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.mechmate.application.port.output.NotificationMetrics;
import in.mechmate.application.port.output.PushSubscriptionRepository;
import in.mechmate.application.port.output.PushTransport;
import in.mechmate.domain.model.NotificationPayload;
import in.mechmate.domain.model.PushResult;
import in.mechmate.domain.model.PushSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Delivers push messages to every registered subscription.
 *
 * Self-healing: a subscription the transport reports as permanently invalid
 * (endpoint gone) is deleted. Each subscription is attempted independently;
 * one failure never aborts delivery to the others.
 */
public final class NotificationDeliveryService {
    private static final Logger log = LoggerFactory.getLogger(NotificationDeliveryService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PushSubscriptionRepository subscriptionRepository;
    private final PushTransport transport;
    private final NotificationMetrics metrics;

    public NotificationDeliveryService(
            PushSubscriptionRepository subscriptionRepository,
            PushTransport transport,
            NotificationMetrics metrics) {
        this.subscriptionRepository = subscriptionRepository;
        this.transport = transport;
        this.metrics = metrics;
    }

    public boolean isConfigured() {
        return transport.isConfigured();
    }

    /**
     * Send one message to one subscription.
     *
     * Side effect: touches last_used_at on success, deletes the subscription
     * when the endpoint is permanently invalid.
     *
     * @return true if the push service accepted the message
     */
    public boolean sendNotification(PushSubscription subscription, NotificationPayload payload) {
        return send(subscription, toJson(payload));
    }

    /**
     * Send one message to all subscriptions, sequentially.
     *
     * @return number of subscriptions that accepted the message
     */
    public int broadcastNotification(NotificationPayload payload) {
        String json = toJson(payload);
        List<PushSubscription> subscriptions = subscriptionRepository.findAll();

        int successCount = 0;
        for (PushSubscription subscription : subscriptions) {
            if (send(subscription, json)) {
                successCount++;
            }
        }

        log.info("[PUSH] Sent '{}' to {}/{} subscriptions", payload.title(), successCount, subscriptions.size());
        return successCount;
    }

    private boolean send(PushSubscription subscription, String json) {
        if (!transport.isConfigured()) {
            log.warn("[PUSH] Cannot send notification: VAPID keys not configured");
            return false;
        }

        PushResult result = transport.send(subscription, json);
        metrics.recordPush(result.outcome());

        switch (result.outcome()) {
            case DELIVERED:
                try {
                    subscriptionRepository.touch(subscription.id());
                } catch (Exception e) {
                    log.warn("[PUSH] Delivered to subscription {} but failed to update last_used_at: {}",
                        subscription.id(), e.getMessage());
                }
                return true;

            case PERMANENTLY_INVALID:
                log.info("[PUSH] Subscription {} is no longer valid (status={}, {}), removing",
                    subscription.id(), result.statusCode(), result.message());
                try {
                    subscriptionRepository.deleteById(subscription.id());
                    metrics.recordSubscriptionPruned();
                    log.info("[PUSH] Removed invalid subscription: {}", subscription.id());
                } catch (Exception e) {
                    log.error("[PUSH] Failed to remove invalid subscription {}: {}",
                        subscription.id(), e.getMessage(), e);
                }
                return false;

            case TRANSIENT_FAILURE:
            default:
                log.warn("[PUSH] Failed to send to subscription {} (status={}): {}",
                    subscription.id(), result.statusCode(), result.message());
                return false;
        }
    }

    private static String toJson(NotificationPayload payload) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize notification payload", e);
        }
    }
}
