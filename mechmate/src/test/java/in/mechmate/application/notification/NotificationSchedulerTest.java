package in.mechmate.application.notification;

import in.mechmate.application.port.output.NotificationLogRepository;
import in.mechmate.application.port.output.NotificationMetrics;
import in.mechmate.application.port.output.RepositoryException;
import in.mechmate.domain.model.CheckResult;
import in.mechmate.domain.model.SchedulerStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for NotificationScheduler.
 *
 * Tests:
 * - Overlapping runs are skipped, not queued
 * - Idempotent start / stop and restart
 * - Status reporting
 * - Interval boundary alignment in the clock's zone
 * - Failed runs are counted
 * - Notification log retention
 */
@ExtendWith(MockitoExtension.class)
class NotificationSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T09:20:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private DueNotificationService notificationService;
    @Mock
    private NotificationLogRepository logRepo;
    @Mock
    private NotificationMetrics metrics;

    private NotificationScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Test
    void runCheckNow_skipsWhileAnotherRunIsInFlight() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(notificationService.checkAndSendDueNotifications()).thenAnswer(inv -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return CheckResult.nothingDue();
        });
        scheduler = newScheduler(Duration.ofMinutes(60), 90);

        CompletableFuture<CheckResult> inFlight = CompletableFuture.supplyAsync(scheduler::runCheckNow);
        assertTrue(started.await(5, TimeUnit.SECONDS), "First run should start");

        CheckResult overlapping = scheduler.runCheckNow();

        assertTrue(overlapping.skipped());
        assertEquals("check already in progress", overlapping.skipReason());
        verify(metrics).recordCheck(true);

        release.countDown();
        assertFalse(inFlight.get(5, TimeUnit.SECONDS).skipped());
        verify(notificationService, times(1)).checkAndSendDueNotifications();
    }

    @Test
    void runCheckNow_releasesLockWhenRunFails() {
        when(notificationService.checkAndSendDueNotifications())
            .thenThrow(new RepositoryException("Failed to find pending tasks", null))
            .thenReturn(CheckResult.nothingDue());
        scheduler = newScheduler(Duration.ofMinutes(60), 90);

        assertThrows(RepositoryException.class, scheduler::runCheckNow);
        verify(metrics).recordCheckFailed();

        assertFalse(scheduler.runCheckNow().skipped());
        verify(metrics).recordCheck(false);
    }

    @Test
    void runCheckNow_updatesStatusTimestamps() {
        when(notificationService.checkAndSendDueNotifications()).thenReturn(CheckResult.nothingDue());
        scheduler = newScheduler(Duration.ofMinutes(60), 90);

        assertNull(scheduler.getStatus().lastRunStartedAt());

        scheduler.runCheckNow();

        SchedulerStatus status = scheduler.getStatus();
        assertEquals(NOW, status.lastRunStartedAt());
        assertEquals(NOW, status.lastRunCompletedAt());
        verify(metrics).recordCheck(false);
    }

    @Test
    void startAndStop_areIdempotent() {
        scheduler = newScheduler(Duration.ofMinutes(60), 90);

        scheduler.start();
        scheduler.start();
        assertTrue(scheduler.isRunning());
        assertTrue(scheduler.getStatus().running());
        assertEquals("every 60 minutes", scheduler.getStatus().scheduleDescriptor());

        scheduler.stop();
        scheduler.stop();
        assertFalse(scheduler.isRunning());

        scheduler.start();
        assertTrue(scheduler.isRunning(), "Scheduler can be restarted after stop");
        verifyNoInteractions(notificationService);
    }

    @Test
    void describeSchedule_subMinuteInterval() {
        scheduler = newScheduler(Duration.ofMillis(1500), 0);

        assertEquals("every 1500 ms", scheduler.describeSchedule());
    }

    @Test
    void delayUntilNextBoundary_alignsToInterval() {
        scheduler = newScheduler(Duration.ofMinutes(60), 90);

        // 09:20 → next run at 10:00
        assertEquals(Duration.ofMinutes(40), scheduler.delayUntilNextBoundary());
    }

    @Test
    void delayUntilNextBoundary_usesLocalHourInHalfHourOffsetZone() {
        // 04:30Z is 10:00 in Kolkata (UTC+05:30): on the local hour already
        Clock kolkata = Clock.fixed(Instant.parse("2026-03-10T04:30:00Z"), ZoneId.of("Asia/Kolkata"));
        scheduler = new NotificationScheduler(notificationService, logRepo, metrics, Duration.ofMinutes(60), 90, kolkata);

        assertEquals(Duration.ofHours(1), scheduler.delayUntilNextBoundary());
    }

    @Test
    void delayUntilNextBoundary_midHourInHalfHourOffsetZone() {
        // 04:50Z is 10:20 in Kolkata → next run at 11:00 local
        Clock kolkata = Clock.fixed(Instant.parse("2026-03-10T04:50:00Z"), ZoneId.of("Asia/Kolkata"));
        scheduler = new NotificationScheduler(notificationService, logRepo, metrics, Duration.ofMinutes(60), 90, kolkata);

        assertEquals(Duration.ofMinutes(40), scheduler.delayUntilNextBoundary());
    }

    @Test
    void constructor_rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> newScheduler(Duration.ZERO, 90));
        assertThrows(IllegalArgumentException.class, () -> newScheduler(Duration.ofMinutes(-5), 90));
    }

    @Test
    void purgeExpiredLogEntries_deletesBeforeRetentionCutoff() {
        when(logRepo.deleteCreatedBefore(any())).thenReturn(4);
        scheduler = newScheduler(Duration.ofMinutes(60), 90);

        assertEquals(4, scheduler.purgeExpiredLogEntries());

        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(logRepo).deleteCreatedBefore(cutoff.capture());
        assertEquals(NOW.minus(Duration.ofDays(90)), cutoff.getValue());
    }

    @Test
    void purgeExpiredLogEntries_neverRemovesTodaysEntries() {
        when(logRepo.deleteCreatedBefore(any())).thenReturn(0);
        scheduler = newScheduler(Duration.ofMinutes(60), 0);

        scheduler.purgeExpiredLogEntries();

        verify(logRepo).deleteCreatedBefore(NOW.minus(Duration.ofDays(1)));
    }

    @Test
    void purgeExpiredLogEntries_swallowsRepositoryFailure() {
        when(logRepo.deleteCreatedBefore(any())).thenThrow(new RepositoryException("db down", null));
        scheduler = newScheduler(Duration.ofMinutes(60), 90);

        assertEquals(0, scheduler.purgeExpiredLogEntries());
    }

    private NotificationScheduler newScheduler(Duration interval, int retentionDays) {
        return new NotificationScheduler(notificationService, logRepo, metrics, interval, retentionDays, CLOCK);
    }
}
