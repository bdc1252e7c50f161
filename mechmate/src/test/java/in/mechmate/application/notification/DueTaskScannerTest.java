package in.mechmate.application.notification;

import in.mechmate.application.port.output.InMemoryMaintenanceCatalog;
import in.mechmate.application.port.output.InMemoryNotificationLogRepository;
import in.mechmate.application.port.output.InMemoryNotificationSettingsRepository;
import in.mechmate.domain.model.DueTask;
import in.mechmate.domain.model.Equipment;
import in.mechmate.domain.model.NotificationSettings;
import in.mechmate.domain.model.TaskStatus;
import in.mechmate.domain.model.ThresholdType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static in.mechmate.application.notification.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DueTaskScanner.
 *
 * Tests:
 * - Threshold matching against settings
 * - Same-day dedup against the notification log
 * - Read-only scanning (repeatable until the log changes)
 * - Missing equipment / task type
 * - Disabled or absent settings
 */
class DueTaskScannerTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T09:00:00Z"), ZoneOffset.UTC);

    private InMemoryMaintenanceCatalog catalog;
    private InMemoryNotificationSettingsRepository settingsRepo;
    private InMemoryNotificationLogRepository logRepo;
    private DueTaskScanner scanner;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryMaintenanceCatalog()
            .add(TRUCK).add(MOWER)
            .add(OIL_CHANGE).add(TIRE_ROTATION);
        settingsRepo = new InMemoryNotificationSettingsRepository(NotificationSettings.defaults());
        logRepo = new InMemoryNotificationLogRepository(CLOCK);
        scanner = new DueTaskScanner(catalog, catalog, catalog.taskTypes(), settingsRepo, logRepo, new ThresholdEvaluator());
    }

    @Test
    void findDueTasks_taskDueInOneWeek() {
        catalog.add(pendingTask(1, TRUCK, OIL_CHANGE, TODAY.plusDays(7)));

        List<DueTask> due = scanner.findDueTasks(TODAY);

        assertEquals(1, due.size());
        DueTask dueTask = due.get(0);
        assertEquals(ThresholdType.ONE_WEEK, dueTask.thresholdType());
        assertEquals(7, dueTask.daysUntilDue());
        assertFalse(dueTask.overdue());
        assertEquals(TRUCK, dueTask.equipment());
        assertEquals(OIL_CHANGE, dueTask.taskType());
    }

    @Test
    void findDueTasks_overdueTaskMatchesOverdueDaily() {
        catalog.add(pendingTask(1, TRUCK, OIL_CHANGE, TODAY.minusDays(4)));

        List<DueTask> due = scanner.findDueTasks(TODAY);

        assertEquals(1, due.size());
        assertEquals(ThresholdType.OVERDUE_DAILY, due.get(0).thresholdType());
        assertEquals(-4, due.get(0).daysUntilDue());
        assertTrue(due.get(0).overdue());
    }

    @Test
    void findDueTasks_scanIsRepeatableUntilLogged() {
        catalog.add(pendingTask(1, TRUCK, OIL_CHANGE, TODAY));

        assertEquals(1, scanner.findDueTasks(TODAY).size());
        assertEquals(1, scanner.findDueTasks(TODAY).size(), "Scanning must not write to the log");
        assertTrue(logRepo.entries().isEmpty());

        logRepo.append(1, ThresholdType.DUE_DATE, TODAY);

        assertTrue(scanner.findDueTasks(TODAY).isEmpty());
    }

    @Test
    void findDueTasks_logFromPreviousDayDoesNotSuppress() {
        catalog.add(pendingTask(1, TRUCK, OIL_CHANGE, TODAY.minusDays(2)));
        logRepo.append(1, ThresholdType.OVERDUE_DAILY, TODAY.minusDays(1));

        List<DueTask> due = scanner.findDueTasks(TODAY);

        assertEquals(1, due.size(), "Overdue tasks are re-announced every day");
    }

    @Test
    void findDueTasks_skipsTaskWithMissingEquipment() {
        Equipment boat = new Equipment(99, "Boat", "hours");
        catalog.add(pendingTask(1, boat, OIL_CHANGE, TODAY));
        catalog.add(pendingTask(2, MOWER, TIRE_ROTATION, TODAY));

        List<DueTask> due = scanner.findDueTasks(TODAY);

        assertEquals(1, due.size());
        assertEquals(2, due.get(0).task().id());
    }

    @Test
    void findDueTasks_skipsNonPendingAndUndatedTasks() {
        catalog.add(task(1, TRUCK, OIL_CHANGE, TaskStatus.COMPLETED, TODAY));
        catalog.add(pendingTask(2, TRUCK, OIL_CHANGE, null));

        assertTrue(scanner.findDueTasks(TODAY).isEmpty());
    }

    @Test
    void findDueTasks_emptyWhenDisabled() {
        catalog.add(pendingTask(1, TRUCK, OIL_CHANGE, TODAY));
        NotificationSettings d = NotificationSettings.defaults();
        settingsRepo.update(new NotificationSettings(false, d.threshold1Month(), d.threshold2Weeks(),
            d.threshold1Week(), d.threshold3Days(), d.threshold1Day(), d.thresholdDueDate(), d.thresholdOverdueDaily()));

        assertTrue(scanner.findDueTasks(TODAY).isEmpty());
    }

    @Test
    void findDueTasks_emptyWhenSettingsMissing() {
        catalog.add(pendingTask(1, TRUCK, OIL_CHANGE, TODAY));
        scanner = new DueTaskScanner(catalog, catalog, catalog.taskTypes(),
            new InMemoryNotificationSettingsRepository(), logRepo, new ThresholdEvaluator());

        assertTrue(scanner.findDueTasks(TODAY).isEmpty());
    }

    @Test
    void findDueTasks_looksUpSharedReferencesOncePerScan() {
        catalog.add(pendingTask(1, TRUCK, OIL_CHANGE, TODAY));
        catalog.add(pendingTask(2, TRUCK, OIL_CHANGE, TODAY.plusDays(1)));
        catalog.add(pendingTask(3, TRUCK, OIL_CHANGE, TODAY.plusDays(7)));

        List<DueTask> due = scanner.findDueTasks(TODAY);

        assertEquals(3, due.size());
        assertEquals(1, catalog.equipmentLookups());
        assertEquals(1, catalog.taskTypeLookups());
    }
}
