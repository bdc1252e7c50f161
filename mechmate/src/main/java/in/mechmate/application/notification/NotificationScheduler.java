package in.mechmate.application.notification;

import in.mechmate.application.port.output.NotificationLogRepository;
import in.mechmate.application.port.output.NotificationMetrics;
import in.mechmate.domain.model.CheckResult;
import in.mechmate.domain.model.SchedulerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives the due-notification check on a fixed interval.
 *
 * Lifecycle: STOPPED → start() → RUNNING → stop() → STOPPED. Repeated start()
 * or stop() calls are logged no-ops.
 *
 * Timer runs and manual {@link #runCheckNow()} calls share one lock. A run that
 * finds another run in flight is skipped, never queued.
 *
 * Owned by the bootstrap code; there is one instance per process.
 */
public final class NotificationScheduler {
    private static final Logger log = LoggerFactory.getLogger(NotificationScheduler.class);

    private static final Duration RETENTION_INTERVAL = Duration.ofDays(1);
    private static final Duration RETENTION_INITIAL_DELAY = Duration.ofMinutes(5);

    private final DueNotificationService notificationService;
    private final NotificationLogRepository notificationLogRepository;
    private final NotificationMetrics metrics;
    private final Duration checkInterval;
    private final int logRetentionDays;
    private final Clock clock;

    private final ReentrantLock runLock = new ReentrantLock();

    private ScheduledExecutorService executor;
    private volatile boolean running = false;
    private volatile Instant lastRunStartedAt;
    private volatile Instant lastRunCompletedAt;

    public NotificationScheduler(
            DueNotificationService notificationService,
            NotificationLogRepository notificationLogRepository,
            NotificationMetrics metrics,
            Duration checkInterval,
            int logRetentionDays,
            Clock clock) {
        if (checkInterval.isZero() || checkInterval.isNegative()) {
            throw new IllegalArgumentException("Check interval must be positive: " + checkInterval);
        }
        this.notificationService = notificationService;
        this.notificationLogRepository = notificationLogRepository;
        this.metrics = metrics;
        this.checkInterval = checkInterval;
        this.logRetentionDays = logRetentionDays;
        this.clock = clock;
    }

    /**
     * Start the repeating check. First run is aligned to the next interval
     * boundary in the clock's zone (top of the local hour for the default
     * 60 minute interval).
     */
    public synchronized void start() {
        if (running) {
            log.info("[SCHEDULER] Notification scheduler is already running");
            return;
        }

        log.info("[SCHEDULER] Starting notification scheduler with schedule: {}", describeSchedule());

        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "notification-scheduler");
            t.setDaemon(true);
            return t;
        });

        executor.scheduleAtFixedRate(
            this::scheduledCheck,
            delayUntilNextBoundary().toMillis(),
            checkInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );

        if (logRetentionDays > 0) {
            executor.scheduleAtFixedRate(
                this::purgeExpiredLogEntries,
                RETENTION_INITIAL_DELAY.toMillis(),
                RETENTION_INTERVAL.toMillis(),
                TimeUnit.MILLISECONDS
            );
        }

        running = true;
        log.info("[SCHEDULER] ✓ Notification scheduler started");
    }

    /**
     * Stop the repeating check. A run already in flight completes.
     */
    public synchronized void stop() {
        if (!running) {
            log.info("[SCHEDULER] Notification scheduler is not running");
            return;
        }

        log.info("[SCHEDULER] Stopping notification scheduler...");
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
            log.info("[SCHEDULER] ✓ Notification scheduler stopped");
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            executor = null;
        }
    }

    public SchedulerStatus getStatus() {
        return new SchedulerStatus(running, describeSchedule(), lastRunStartedAt, lastRunCompletedAt);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run one check immediately on the caller's thread, bypassing the timer.
     *
     * @return run summary; {@code skipped} if another run holds the lock
     */
    public CheckResult runCheckNow() {
        if (!runLock.tryLock()) {
            log.warn("[SCHEDULER] Notification check already in progress, skipping");
            metrics.recordCheck(true);
            return CheckResult.skipped("check already in progress");
        }

        try {
            lastRunStartedAt = clock.instant();
            CheckResult result = notificationService.checkAndSendDueNotifications();
            metrics.recordCheck(result.skipped());
            return result;
        } catch (RuntimeException e) {
            metrics.recordCheckFailed();
            throw e;
        } finally {
            lastRunCompletedAt = clock.instant();
            runLock.unlock();
        }
    }

    /**
     * Delete notification log entries older than the retention window.
     *
     * @return number of entries removed
     */
    public int purgeExpiredLogEntries() {
        try {
            // At least one day, so entries dated today are never removed
            Instant cutoff = clock.instant().minus(Duration.ofDays(Math.max(1, logRetentionDays)));
            int removed = notificationLogRepository.deleteCreatedBefore(cutoff);
            if (removed > 0) {
                log.info("[SCHEDULER] Purged {} notification log entries older than {} days", removed, logRetentionDays);
            }
            return removed;
        } catch (Exception e) {
            log.error("[SCHEDULER] Failed to purge notification log: {}", e.getMessage(), e);
            return 0;
        }
    }

    String describeSchedule() {
        long millis = checkInterval.toMillis();
        if (millis % 60_000 == 0) {
            return "every " + checkInterval.toMinutes() + " minutes";
        }
        return "every " + millis + " ms";
    }

    /**
     * Time until the next multiple of the interval counted from local midnight
     * in the clock's zone, so hourly checks land on the local top of the hour.
     */
    Duration delayUntilNextBoundary() {
        long intervalMillis = checkInterval.toMillis();
        ZonedDateTime now = ZonedDateTime.now(clock);
        long sinceMidnight = Duration.between(now.truncatedTo(ChronoUnit.DAYS), now).toMillis();
        return Duration.ofMillis(intervalMillis - (sinceMidnight % intervalMillis));
    }

    private void scheduledCheck() {
        log.info("[SCHEDULER] Running scheduled notification check...");
        try {
            runCheckNow();
        } catch (Exception e) {
            log.error("[SCHEDULER] Error in scheduled notification check: {}", e.getMessage(), e);
        }
    }
}
