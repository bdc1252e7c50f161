package in.mechmate.infrastructure.metrics;

import in.mechmate.application.port.output.NotificationMetrics;
import in.mechmate.domain.model.PushResult;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

import java.util.Locale;

/**
 * Prometheus implementation of NotificationMetrics.
 *
 * Key Metrics:
 * - notification_checks_total{result} - Pipeline runs (completed / skipped / failed)
 * - notification_due_tasks - Due tasks found by the last run
 * - notification_pushes_total{outcome} - Per-subscription push attempts
 * - notification_subscriptions_pruned_total - Subscriptions removed as invalid
 * - notification_ledger_writes_total{status} - Dedup ledger appends
 */
public class PrometheusNotificationMetrics implements NotificationMetrics {

    private final CollectorRegistry registry;

    private final Counter checkCounter;
    private final Gauge dueTasks;
    private final Counter pushCounter;
    private final Counter prunedCounter;
    private final Counter ledgerCounter;

    public PrometheusNotificationMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusNotificationMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.checkCounter = Counter.build()
            .name("notification_checks_total")
            .help("Total number of due-notification checks")
            .labelNames("result")
            .register(registry);

        this.dueTasks = Gauge.build()
            .name("notification_due_tasks")
            .help("Due tasks found by the most recent check")
            .register(registry);

        this.pushCounter = Counter.build()
            .name("notification_pushes_total")
            .help("Total number of push attempts per subscription")
            .labelNames("outcome")
            .register(registry);

        this.prunedCounter = Counter.build()
            .name("notification_subscriptions_pruned_total")
            .help("Subscriptions removed because the endpoint is gone")
            .register(registry);

        this.ledgerCounter = Counter.build()
            .name("notification_ledger_writes_total")
            .help("Total number of notification log appends")
            .labelNames("status")
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordCheck(boolean skipped) {
        checkCounter.labels(skipped ? "skipped" : "completed").inc();
    }

    @Override
    public void recordCheckFailed() {
        checkCounter.labels("failed").inc();
    }

    @Override
    public void recordDueTasks(int count) {
        dueTasks.set(count);
    }

    @Override
    public void recordPush(PushResult.Outcome outcome) {
        pushCounter.labels(outcome.name().toLowerCase(Locale.ROOT)).inc();
    }

    @Override
    public void recordSubscriptionPruned() {
        prunedCounter.inc();
    }

    @Override
    public void recordLedgerWrite(boolean success) {
        ledgerCounter.labels(success ? "success" : "failure").inc();
    }
}
