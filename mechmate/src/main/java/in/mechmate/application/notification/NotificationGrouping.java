package in.mechmate.application.notification;

import in.mechmate.domain.model.DueTask;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions due tasks into notification groups by urgency.
 *
 * Groups smaller than {@link #BATCH_THRESHOLD} go out as one push per task;
 * larger groups go out as a single summary push.
 */
public final class NotificationGrouping {

    public static final int BATCH_THRESHOLD = 3;

    public enum UrgencyBucket {
        OVERDUE,
        TODAY,
        THIS_WEEK,
        FUTURE;

        public static UrgencyBucket of(DueTask dueTask) {
            if (dueTask.overdue()) {
                return OVERDUE;
            } else if (dueTask.daysUntilDue() == 0) {
                return TODAY;
            } else if (dueTask.daysUntilDue() <= 7) {
                return THIS_WEEK;
            }
            return FUTURE;
        }
    }

    public record NotificationGroup(UrgencyBucket bucket, List<DueTask> tasks) {

        public boolean isBatched() {
            return tasks.size() >= BATCH_THRESHOLD;
        }
    }

    /**
     * One group per non-empty bucket, buckets in first-seen order.
     */
    public List<NotificationGroup> group(List<DueTask> dueTasks) {
        Map<UrgencyBucket, List<DueTask>> buckets = new LinkedHashMap<>();
        for (DueTask dueTask : dueTasks) {
            buckets.computeIfAbsent(UrgencyBucket.of(dueTask), b -> new ArrayList<>()).add(dueTask);
        }

        List<NotificationGroup> groups = new ArrayList<>(buckets.size());
        buckets.forEach((bucket, tasks) -> groups.add(new NotificationGroup(bucket, List.copyOf(tasks))));
        return groups;
    }
}
