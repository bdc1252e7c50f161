package in.mechmate.domain.model;

/**
 * Maintenance task lifecycle status.
 */
public enum TaskStatus {
    PENDING,
    COMPLETED,
    OVERDUE;

    public static TaskStatus fromDb(String value) {
        return TaskStatus.valueOf(value.trim().toUpperCase());
    }
}
