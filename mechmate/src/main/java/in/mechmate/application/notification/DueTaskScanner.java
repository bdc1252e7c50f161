package in.mechmate.application.notification;

import in.mechmate.application.port.output.EquipmentRepository;
import in.mechmate.application.port.output.NotificationLogRepository;
import in.mechmate.application.port.output.NotificationSettingsRepository;
import in.mechmate.application.port.output.TaskRepository;
import in.mechmate.application.port.output.TaskTypeRepository;
import in.mechmate.domain.model.DueTask;
import in.mechmate.domain.model.Equipment;
import in.mechmate.domain.model.NotificationSettings;
import in.mechmate.domain.model.Task;
import in.mechmate.domain.model.TaskType;
import in.mechmate.domain.model.ThresholdType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds (task, threshold) pairs that are due today and not yet announced.
 *
 * READ-ONLY: never writes to the notification log. Scanning twice on the same
 * day returns the same result until a ledger append commits.
 */
public final class DueTaskScanner {
    private static final Logger log = LoggerFactory.getLogger(DueTaskScanner.class);

    private final TaskRepository taskRepository;
    private final EquipmentRepository equipmentRepository;
    private final TaskTypeRepository taskTypeRepository;
    private final NotificationSettingsRepository settingsRepository;
    private final NotificationLogRepository notificationLogRepository;
    private final ThresholdEvaluator evaluator;

    public DueTaskScanner(
            TaskRepository taskRepository,
            EquipmentRepository equipmentRepository,
            TaskTypeRepository taskTypeRepository,
            NotificationSettingsRepository settingsRepository,
            NotificationLogRepository notificationLogRepository,
            ThresholdEvaluator evaluator) {
        this.taskRepository = taskRepository;
        this.equipmentRepository = equipmentRepository;
        this.taskTypeRepository = taskTypeRepository;
        this.settingsRepository = settingsRepository;
        this.notificationLogRepository = notificationLogRepository;
        this.evaluator = evaluator;
    }

    /**
     * Scan all pending tasks for thresholds owed today.
     *
     * @param today calendar day of the scan
     * @return due tasks; empty when notifications are disabled or unconfigured
     */
    public List<DueTask> findDueTasks(LocalDate today) {
        Optional<NotificationSettings> settingsOpt = settingsRepository.getSettings();
        if (settingsOpt.isEmpty() || !settingsOpt.get().enabled()) {
            log.info("[NOTIFY] Notifications disabled, skipping scan");
            return List.of();
        }
        NotificationSettings settings = settingsOpt.get();

        // Loaded once per id per scan
        Map<Long, Optional<Equipment>> equipmentCache = new HashMap<>();
        Map<Long, Optional<TaskType>> taskTypeCache = new HashMap<>();

        List<DueTask> dueTasks = new ArrayList<>();
        for (Task task : taskRepository.findAllPending()) {
            if (!task.isPending()) continue;

            Optional<Equipment> equipment =
                equipmentCache.computeIfAbsent(task.equipmentId(), equipmentRepository::findById);
            Optional<TaskType> taskType =
                taskTypeCache.computeIfAbsent(task.taskTypeId(), taskTypeRepository::findById);

            if (equipment.isEmpty() || taskType.isEmpty()) {
                log.warn("[NOTIFY] Skipping task {}: equipment {} or task type {} not found",
                    task.id(), task.equipmentId(), task.taskTypeId());
                continue;
            }

            List<ThresholdType> matches = evaluator.matchingThresholds(task, today, settings);
            if (matches.isEmpty()) continue;

            int daysUntilDue = evaluator.daysUntilDue(task, today);
            for (ThresholdType type : matches) {
                if (notificationLogRepository.hasBeenSent(task.id(), type, today)) {
                    log.debug("[NOTIFY] Task {} already notified for {} on {}", task.id(), type.getCode(), today);
                    continue;
                }
                dueTasks.add(DueTask.of(task, equipment.get(), taskType.get(), daysUntilDue, type));
            }
        }

        return dueTasks;
    }
}
