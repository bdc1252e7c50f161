package in.mechmate.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Maintenance task for one piece of equipment.
 *
 * Owned by the equipment/task storage layer; the notification engine only reads it.
 */
public record Task(
        long id,
        long equipmentId,
        long taskTypeId,
        String title,
        TaskStatus status,
        BigDecimal usageInterval,       // recurrence by usage delta, nullable
        Integer timeIntervalDays,       // recurrence by elapsed days, nullable
        LocalDate nextDueDate,          // nullable
        BigDecimal nextDueUsageValue) { // nullable

    public boolean isPending() {
        return status == TaskStatus.PENDING;
    }

    public boolean hasDueDate() {
        return nextDueDate != null;
    }
}
