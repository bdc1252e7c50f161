package in.mechmate.domain.model;

/**
 * A task that currently satisfies a threshold and has not been announced for it today.
 *
 * Computed fresh on every scan, never persisted.
 */
public record DueTask(
        Task task,
        Equipment equipment,
        TaskType taskType,
        int daysUntilDue,
        boolean overdue,
        ThresholdType thresholdType) {

    public static DueTask of(Task task, Equipment equipment, TaskType taskType,
                             int daysUntilDue, ThresholdType thresholdType) {
        return new DueTask(task, equipment, taskType, daysUntilDue, daysUntilDue < 0, thresholdType);
    }
}
