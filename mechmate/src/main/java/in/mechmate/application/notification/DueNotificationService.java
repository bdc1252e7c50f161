package in.mechmate.application.notification;

import in.mechmate.application.notification.NotificationGrouping.NotificationGroup;
import in.mechmate.application.port.output.NotificationLogRepository;
import in.mechmate.application.port.output.NotificationMetrics;
import in.mechmate.domain.model.CheckResult;
import in.mechmate.domain.model.DueTask;
import in.mechmate.domain.model.NotificationLedgerPolicy;
import in.mechmate.domain.model.NotificationPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Due-notification pipeline: scan → group → compose → deliver → record.
 *
 * One call is one complete run. Ledger writes happen only after the broadcast
 * for a task (or batch) has been attempted, and follow the configured
 * {@link NotificationLedgerPolicy}.
 */
public final class DueNotificationService {
    private static final Logger log = LoggerFactory.getLogger(DueNotificationService.class);

    private final DueTaskScanner scanner;
    private final NotificationGrouping grouping;
    private final NotificationComposer composer;
    private final NotificationDeliveryService deliveryService;
    private final NotificationLogRepository notificationLogRepository;
    private final NotificationLedgerPolicy ledgerPolicy;
    private final NotificationMetrics metrics;
    private final Clock clock;

    public DueNotificationService(
            DueTaskScanner scanner,
            NotificationGrouping grouping,
            NotificationComposer composer,
            NotificationDeliveryService deliveryService,
            NotificationLogRepository notificationLogRepository,
            NotificationLedgerPolicy ledgerPolicy,
            NotificationMetrics metrics,
            Clock clock) {
        this.scanner = scanner;
        this.grouping = grouping;
        this.composer = composer;
        this.deliveryService = deliveryService;
        this.notificationLogRepository = notificationLogRepository;
        this.ledgerPolicy = ledgerPolicy;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Run one full check for the current calendar day.
     */
    public CheckResult checkAndSendDueNotifications() {
        log.info("[NOTIFY] Checking for due notifications...");

        if (!deliveryService.isConfigured()) {
            log.info("[NOTIFY] Push notifications not configured, skipping check");
            return CheckResult.skipped("push notifications not configured");
        }

        LocalDate today = LocalDate.now(clock);
        List<DueTask> dueTasks = scanner.findDueTasks(today);
        metrics.recordDueTasks(dueTasks.size());

        if (dueTasks.isEmpty()) {
            log.info("[NOTIFY] No due tasks found");
            return CheckResult.nothingDue();
        }

        log.info("[NOTIFY] Found {} due tasks", dueTasks.size());

        Tally tally = new Tally();
        for (NotificationGroup group : grouping.group(dueTasks)) {
            sendGroup(group, today, tally);
        }

        log.info("[NOTIFY] Check complete: {} due, {} notifications, {} deliveries, {} ledger entries",
            dueTasks.size(), tally.notifications, tally.deliveries, tally.ledgerEntries);
        return new CheckResult(false, null, dueTasks.size(), tally.notifications, tally.deliveries, tally.ledgerEntries);
    }

    /**
     * Broadcast a fixed test message. Bypasses scanning and the ledger.
     *
     * @return number of subscriptions that accepted the message
     */
    public int sendTestBroadcast() {
        return deliveryService.broadcastNotification(composer.test());
    }

    private void sendGroup(NotificationGroup group, LocalDate today, Tally tally) {
        if (group.isBatched()) {
            NotificationPayload payload = composer.batched(group);
            int delivered = deliveryService.broadcastNotification(payload);
            tally.notifications++;
            tally.deliveries += delivered;
            record(group.tasks(), delivered, today, tally);
        } else {
            for (DueTask dueTask : group.tasks()) {
                NotificationPayload payload = composer.individual(dueTask);
                int delivered = deliveryService.broadcastNotification(payload);
                tally.notifications++;
                tally.deliveries += delivered;
                record(List.of(dueTask), delivered, today, tally);
            }
        }
    }

    private void record(List<DueTask> dueTasks, int delivered, LocalDate today, Tally tally) {
        if (!ledgerPolicy.shouldRecord(delivered)) {
            log.warn("[NOTIFY] No subscription received notification for {} task(s); not recording (policy={})",
                dueTasks.size(), ledgerPolicy);
            return;
        }

        for (DueTask dueTask : dueTasks) {
            try {
                notificationLogRepository.append(dueTask.task().id(), dueTask.thresholdType(), today);
                metrics.recordLedgerWrite(true);
                tally.ledgerEntries++;
            } catch (Exception e) {
                // Task may be re-announced next run
                metrics.recordLedgerWrite(false);
                log.error("[NOTIFY] Failed to log notification for task {} ({}): {}",
                    dueTask.task().id(), dueTask.thresholdType().getCode(), e.getMessage(), e);
            }
        }
    }

    private static final class Tally {
        int notifications;
        int deliveries;
        int ledgerEntries;
    }
}
