package in.mechmate.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.mechmate.application.notification.DueNotificationService;
import in.mechmate.application.notification.NotificationScheduler;
import in.mechmate.application.notification.PushSubscriptionService;
import in.mechmate.application.port.output.NotificationSettingsRepository;
import in.mechmate.application.port.output.PushTransport;
import in.mechmate.domain.model.CheckResult;
import in.mechmate.domain.model.NotificationSettings;
import in.mechmate.domain.model.PushSubscription;
import in.mechmate.domain.model.SchedulerStatus;
import io.undertow.Handlers;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Deque;

/**
 * HTTP handlers for notification endpoints.
 *
 * Provides REST API for:
 * - POST   /api/notifications/check                - run a due-notification check now
 * - POST   /api/notifications/test                 - broadcast a test notification
 * - GET    /api/notifications/scheduler            - scheduler status
 * - GET    /api/notifications/settings             - settings, subscriptions, VAPID public key
 * - PUT    /api/notifications/settings             - update settings
 * - POST   /api/notifications/subscribe            - register a push subscription
 * - DELETE /api/notifications/unsubscribe          - remove a subscription by endpoint
 * - DELETE /api/notifications/subscriptions/{id}   - remove a subscription by id
 */
public final class NotificationHandlers {
    private static final Logger log = LoggerFactory.getLogger(NotificationHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final String JSON_SUCCESS = "success";
    private static final String JSON_MESSAGE = "message";
    private static final String JSON_ERROR = "error";

    private final NotificationScheduler scheduler;
    private final DueNotificationService notificationService;
    private final PushSubscriptionService subscriptionService;
    private final NotificationSettingsRepository settingsRepository;
    private final PushTransport transport;

    public NotificationHandlers(
            NotificationScheduler scheduler,
            DueNotificationService notificationService,
            PushSubscriptionService subscriptionService,
            NotificationSettingsRepository settingsRepository,
            PushTransport transport) {
        this.scheduler = scheduler;
        this.notificationService = notificationService;
        this.subscriptionService = subscriptionService;
        this.settingsRepository = settingsRepository;
        this.transport = transport;
    }

    /**
     * Route table for the health check and all notification endpoints.
     */
    public RoutingHandler routes() {
        return Handlers.routing()
            .get("/api/health", this::health)
            .post("/api/notifications/check", this::checkNow)
            .post("/api/notifications/test", this::sendTest)
            .get("/api/notifications/scheduler", this::schedulerStatus)
            .get("/api/notifications/settings", this::getSettings)
            .put("/api/notifications/settings", this::updateSettings)
            .post("/api/notifications/subscribe", this::subscribe)
            .delete("/api/notifications/unsubscribe", this::unsubscribe)
            .delete("/api/notifications/subscriptions/{id}", this::deleteSubscription);
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", Instant.now().toString());
        health.put("pushConfigured", transport.isConfigured());
        health.put("schedulerRunning", scheduler.isRunning());
        sendJson(exchange, StatusCodes.OK, health);
    }

    /**
     * POST /api/notifications/check
     */
    public void checkNow(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::checkNow);
            return;
        }

        try {
            CheckResult result = scheduler.runCheckNow();
            ObjectNode response = MAPPER.createObjectNode();
            response.put(JSON_SUCCESS, true);
            response.put(JSON_MESSAGE, result.skipped()
                    ? "Notification check skipped: " + result.skipReason()
                    : "Notification check completed");
            response.set("result", MAPPER.valueToTree(result));
            sendJson(exchange, StatusCodes.OK, response);
        } catch (Exception e) {
            log.error("Error checking notifications: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to check notifications");
        }
    }

    /**
     * POST /api/notifications/test
     */
    public void sendTest(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::sendTest);
            return;
        }

        try {
            int sentCount = notificationService.sendTestBroadcast();
            ObjectNode response = MAPPER.createObjectNode();
            response.put(JSON_SUCCESS, true);
            response.put(JSON_MESSAGE, "Test notification sent to " + sentCount + " device(s)");
            response.put("sentCount", sentCount);
            sendJson(exchange, StatusCodes.OK, response);
        } catch (Exception e) {
            log.error("Error sending test notification: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to send test notification");
        }
    }

    /**
     * GET /api/notifications/scheduler
     */
    public void schedulerStatus(HttpServerExchange exchange) {
        SchedulerStatus status = scheduler.getStatus();
        sendJson(exchange, StatusCodes.OK, MAPPER.valueToTree(status));
    }

    /**
     * GET /api/notifications/settings
     */
    public void getSettings(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::getSettings);
            return;
        }

        try {
            ObjectNode response = MAPPER.createObjectNode();
            response.set("settings", settingsRepository.getSettings()
                    .<JsonNode>map(MAPPER::valueToTree)
                    .orElse(MAPPER.nullNode()));

            ArrayNode subscriptions = response.putArray("subscriptions");
            for (PushSubscription sub : subscriptionService.list()) {
                ObjectNode node = subscriptions.addObject();
                node.put("id", sub.id());
                node.put("endpoint", sub.endpoint());
                node.put("user_agent", sub.userAgent());
                node.put("created_at", sub.createdAt() != null ? sub.createdAt().toString() : null);
                node.put("last_used_at", sub.lastUsedAt() != null ? sub.lastUsedAt().toString() : null);
            }

            response.put("vapidPublicKey", transport.publicKey());
            sendJson(exchange, StatusCodes.OK, response);
        } catch (Exception e) {
            log.error("Error fetching notification settings: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to fetch settings");
        }
    }

    /**
     * PUT /api/notifications/settings
     */
    public void updateSettings(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((exch, body) -> {
            try {
                JsonNode json = MAPPER.readTree(body);
                if (json == null || !json.path("enabled").isBoolean()) {
                    sendError(exch, StatusCodes.BAD_REQUEST, "Invalid settings data");
                    return;
                }

                NotificationSettings updated = settingsRepository.update(
                        MAPPER.treeToValue(json, NotificationSettings.class));

                ObjectNode response = MAPPER.createObjectNode();
                response.put(JSON_SUCCESS, true);
                response.set("settings", MAPPER.valueToTree(updated));
                sendJson(exch, StatusCodes.OK, response);

                log.info("PUT /api/notifications/settings → 200 OK (enabled={})", updated.enabled());
            } catch (Exception e) {
                log.error("Error updating notification settings: {}", e.getMessage(), e);
                sendError(exch, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to update settings");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/notifications/subscribe
     *
     * Body: {"endpoint": "...", "keys": {"p256dh": "...", "auth": "..."}, "userAgent": "..."}
     */
    public void subscribe(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((exch, body) -> {
            try {
                JsonNode json = MAPPER.readTree(body);
                PushSubscription subscription = subscriptionService.subscribe(
                        text(json, "endpoint"),
                        text(json.path("keys"), "p256dh"),
                        text(json.path("keys"), "auth"),
                        text(json, "userAgent"));

                ObjectNode response = MAPPER.createObjectNode();
                response.put(JSON_SUCCESS, true);
                response.set("subscription", MAPPER.valueToTree(subscription));
                sendJson(exch, StatusCodes.OK, response);
            } catch (IllegalArgumentException e) {
                sendError(exch, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (Exception e) {
                log.error("Error creating notification subscription: {}", e.getMessage(), e);
                sendError(exch, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to create subscription");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * DELETE /api/notifications/unsubscribe
     *
     * Body: {"endpoint": "..."}
     */
    public void unsubscribe(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((exch, body) -> {
            try {
                JsonNode json = MAPPER.readTree(body);
                if (!subscriptionService.unsubscribe(text(json, "endpoint"))) {
                    sendError(exch, StatusCodes.NOT_FOUND, "Subscription not found");
                    return;
                }
                sendSuccess(exch);
            } catch (IllegalArgumentException e) {
                sendError(exch, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (Exception e) {
                log.error("Error deleting notification subscription: {}", e.getMessage(), e);
                sendError(exch, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to delete subscription");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * DELETE /api/notifications/subscriptions/{id}
     */
    public void deleteSubscription(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::deleteSubscription);
            return;
        }

        Deque<String> idParam = exchange.getQueryParameters().get("id");
        if (idParam == null || idParam.isEmpty()) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Missing ID");
            return;
        }

        long subscriptionId;
        try {
            subscriptionId = Long.parseLong(idParam.getFirst());
        } catch (NumberFormatException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid subscription ID");
            return;
        }

        try {
            if (!subscriptionService.delete(subscriptionId)) {
                sendError(exchange, StatusCodes.NOT_FOUND, "Subscription not found");
                return;
            }
            sendSuccess(exchange);
        } catch (Exception e) {
            log.error("Error deleting notification subscription {}: {}", subscriptionId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to delete subscription");
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private void sendSuccess(HttpServerExchange exchange) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put(JSON_SUCCESS, true);
        sendJson(exchange, StatusCodes.OK, response);
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, JsonNode body) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put(JSON_SUCCESS, false);
        error.put(JSON_ERROR, message);
        sendJson(exchange, statusCode, error);
    }
}
