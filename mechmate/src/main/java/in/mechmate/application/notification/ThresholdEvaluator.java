package in.mechmate.application.notification;

import in.mechmate.domain.model.NotificationSettings;
import in.mechmate.domain.model.Task;
import in.mechmate.domain.model.ThresholdType;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides which notification thresholds a task satisfies on a given day.
 *
 * Pure: no I/O, no clock. Day arithmetic works on {@link LocalDate}, so both
 * dates are implicitly at midnight and the difference is a whole number of days.
 */
public final class ThresholdEvaluator {

    /**
     * Signed number of days from {@code today} until the task is due.
     * Negative when overdue.
     *
     * @throws IllegalArgumentException if the task has no due date
     */
    public int daysUntilDue(Task task, LocalDate today) {
        if (!task.hasDueDate()) {
            throw new IllegalArgumentException("Task " + task.id() + " has no due date");
        }
        return Math.toIntExact(ChronoUnit.DAYS.between(today, task.nextDueDate()));
    }

    /**
     * Enabled thresholds the task currently satisfies, in declaration order.
     * Tasks without a due date never match.
     */
    public List<ThresholdType> matchingThresholds(Task task, LocalDate today, NotificationSettings settings) {
        if (!task.hasDueDate()) {
            return List.of();
        }

        int daysDiff = daysUntilDue(task, today);
        List<ThresholdType> matches = new ArrayList<>(1);
        for (ThresholdType type : ThresholdType.values()) {
            if (settings.isEnabled(type) && type.matches(daysDiff)) {
                matches.add(type);
            }
        }
        return matches;
    }
}
