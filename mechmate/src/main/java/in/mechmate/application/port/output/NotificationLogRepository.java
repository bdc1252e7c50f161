package in.mechmate.application.port.output;

import in.mechmate.domain.model.NotificationLogEntry;
import in.mechmate.domain.model.ThresholdType;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Dedup ledger for due-task notifications (notification_log table).
 *
 * OWNERSHIP:
 * Only DueNotificationService appends; only the retention job deletes.
 *
 * The ledger is append-only. Duplicate rows for the same key are tolerated;
 * callers always check {@link #hasBeenSent} before acting.
 */
public interface NotificationLogRepository {

    /**
     * Has (task, threshold) already been announced on the given calendar day?
     */
    boolean hasBeenSent(long taskId, ThresholdType thresholdType, LocalDate notificationDate);

    /**
     * Record that (task, threshold) was announced on the given calendar day.
     */
    NotificationLogEntry append(long taskId, ThresholdType thresholdType, LocalDate notificationDate);

    /**
     * Delete entries created before the cutoff.
     *
     * @return number of rows removed
     */
    int deleteCreatedBefore(Instant cutoff);
}
