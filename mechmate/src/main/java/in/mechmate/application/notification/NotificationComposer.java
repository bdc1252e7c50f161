package in.mechmate.application.notification;

import in.mechmate.application.notification.NotificationGrouping.NotificationGroup;
import in.mechmate.domain.model.DueTask;
import in.mechmate.domain.model.NotificationPayload;

/**
 * Renders human-readable push messages.
 */
public final class NotificationComposer {

    static final String TITLE_OVERDUE = "Overdue Maintenance";
    static final String TITLE_UPCOMING = "Upcoming Maintenance";
    static final String TITLE_MIXED = "Maintenance Updates";
    static final String TITLE_TEST = "MechMate Test Notification";

    /**
     * Message for a single due task, e.g. "Oil Change due for Truck in 7 days".
     */
    public NotificationPayload individual(DueTask dueTask) {
        String title = dueTask.overdue() ? TITLE_OVERDUE : TITLE_UPCOMING;
        String body = String.format("%s due for %s %s",
            dueTask.taskType().name(), dueTask.equipment().name(), timeframe(dueTask.daysUntilDue()));
        return NotificationPayload.of(title, body);
    }

    /**
     * Summary message for a group of tasks.
     */
    public NotificationPayload batched(NotificationGroup group) {
        long overdue = group.tasks().stream().filter(DueTask::overdue).count();
        long upcoming = group.tasks().size() - overdue;

        if (overdue > 0 && upcoming > 0) {
            return NotificationPayload.of(TITLE_MIXED,
                String.format("You have %d overdue and %d upcoming maintenance tasks", overdue, upcoming));
        }
        if (overdue > 0) {
            return NotificationPayload.of(TITLE_OVERDUE,
                String.format("You have %d overdue maintenance tasks", overdue));
        }

        String when = switch (group.bucket()) {
            case TODAY -> "today";
            case THIS_WEEK -> "this week";
            default -> "soon";
        };
        return NotificationPayload.of(TITLE_UPCOMING,
            String.format("You have %d maintenance tasks due %s", upcoming, when));
    }

    public NotificationPayload test() {
        return NotificationPayload.of(TITLE_TEST, "Your notifications are working correctly!");
    }

    static String timeframe(int daysUntilDue) {
        if (daysUntilDue < 0) {
            int daysPast = -daysUntilDue;
            return daysPast == 1 ? "yesterday" : daysPast + " days ago";
        }
        if (daysUntilDue == 0) {
            return "today";
        }
        if (daysUntilDue == 1) {
            return "tomorrow";
        }
        return "in " + daysUntilDue + " days";
    }
}
