package in.mechmate.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.mechmate.application.notification.DueNotificationService;
import in.mechmate.application.notification.DueTaskScanner;
import in.mechmate.application.notification.NotificationComposer;
import in.mechmate.application.notification.NotificationDeliveryService;
import in.mechmate.application.notification.NotificationGrouping;
import in.mechmate.application.notification.NotificationScheduler;
import in.mechmate.application.notification.PushSubscriptionService;
import in.mechmate.application.notification.ThresholdEvaluator;
import in.mechmate.application.port.output.NotificationLogRepository;
import in.mechmate.application.port.output.NotificationSettingsRepository;
import in.mechmate.application.port.output.PushSubscriptionRepository;
import in.mechmate.config.NotificationConfig;
import in.mechmate.infrastructure.metrics.PrometheusMetricsHandler;
import in.mechmate.infrastructure.metrics.PrometheusNotificationMetrics;
import in.mechmate.infrastructure.persistence.PostgresEquipmentRepository;
import in.mechmate.infrastructure.persistence.PostgresNotificationLogRepository;
import in.mechmate.infrastructure.persistence.PostgresNotificationSettingsRepository;
import in.mechmate.infrastructure.persistence.PostgresPushSubscriptionRepository;
import in.mechmate.infrastructure.persistence.PostgresTaskRepository;
import in.mechmate.infrastructure.persistence.PostgresTaskTypeRepository;
import in.mechmate.infrastructure.push.WebPushTransport;
import in.mechmate.migration.NotificationSchemaMigration;
import in.mechmate.transport.http.NotificationHandlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * MechMate notification service entry point.
 *
 * Wires:
 * - PostgreSQL repositories and schema migration
 * - Web Push transport (VAPID)
 * - Due-notification pipeline and its scheduler
 * - Notification HTTP API and Prometheus /metrics
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== MechMate Notifications Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        NotificationConfig config = NotificationConfig.fromEnv();
        config.validate();
        Clock clock = Clock.system(config.zone());

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);

        // ═══════════════════════════════════════════════════════════════
        // Notification Schema Migration (runs on startup)
        // ═══════════════════════════════════════════════════════════════
        new NotificationSchemaMigration(dataSource).migrate();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusNotificationMetrics metrics = new PrometheusNotificationMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Repositories
        // ═══════════════════════════════════════════════════════════════
        NotificationSettingsRepository settingsRepo = new PostgresNotificationSettingsRepository(dataSource);
        NotificationLogRepository notificationLogRepo = new PostgresNotificationLogRepository(dataSource);
        PushSubscriptionRepository subscriptionRepo = new PostgresPushSubscriptionRepository(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Web Push Transport
        // ═══════════════════════════════════════════════════════════════
        WebPushTransport transport = new WebPushTransport(
            config.vapidPublicKey(), config.vapidPrivateKey(), config.vapidSubject(), config.pushTimeout());

        // ═══════════════════════════════════════════════════════════════
        // Due-Notification Pipeline
        // ═══════════════════════════════════════════════════════════════
        DueTaskScanner scanner = new DueTaskScanner(
            new PostgresTaskRepository(dataSource),
            new PostgresEquipmentRepository(dataSource),
            new PostgresTaskTypeRepository(dataSource),
            settingsRepo,
            notificationLogRepo,
            new ThresholdEvaluator());

        NotificationDeliveryService deliveryService =
            new NotificationDeliveryService(subscriptionRepo, transport, metrics);

        DueNotificationService notificationService = new DueNotificationService(
            scanner,
            new NotificationGrouping(),
            new NotificationComposer(),
            deliveryService,
            notificationLogRepo,
            config.ledgerPolicy(),
            metrics,
            clock);

        NotificationScheduler scheduler = new NotificationScheduler(
            notificationService,
            notificationLogRepo,
            metrics,
            config.checkInterval(),
            config.logRetentionDays(),
            clock);
        scheduler.start();

        // ═══════════════════════════════════════════════════════════════
        // HTTP API
        // ═══════════════════════════════════════════════════════════════
        NotificationHandlers handlers = new NotificationHandlers(
            scheduler,
            notificationService,
            new PushSubscriptionService(subscriptionRepo),
            settingsRepo,
            transport);

        RoutingHandler routes = handlers.routes()
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));

        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, PUT, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        Undertow server = Undertow.builder()
            .addHttpListener(config.httpPort(), "0.0.0.0")
            .setHandler(corsHandler)
            .build();

        server.start();
        log.info("✓ HTTP API server started on port {}", config.httpPort());

        // ═══════════════════════════════════════════════════════════════
        // Shutdown Hook
        // ═══════════════════════════════════════════════════════════════
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down MechMate notifications...");
            scheduler.stop();
            server.stop();
            dataSource.close();
            log.info("✓ Shutdown complete");
        }, "shutdown-hook"));
    }

    private static HikariDataSource createDataSource(NotificationConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPassword());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(Math.min(2, config.dbPoolSize()));
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("mechmate-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }
}
