package in.mechmate.domain.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Dedup ledger row. (taskId, thresholdType, notificationDate) is the dedup key.
 */
public record NotificationLogEntry(
        long id,
        long taskId,
        ThresholdType thresholdType,
        LocalDate notificationDate,
        Instant createdAt) {
}
