package in.mechmate.domain.model;

import java.time.Instant;

/**
 * Snapshot of the notification scheduler state.
 */
public record SchedulerStatus(
        boolean running,
        String scheduleDescriptor,
        Instant lastRunStartedAt,     // nullable
        Instant lastRunCompletedAt) { // nullable
}
