package in.mechmate.domain.model;

/**
 * Summary of one due-notification pipeline run.
 */
public record CheckResult(
        boolean skipped,
        String skipReason,
        int dueTasks,
        int notificationsSent,     // broadcasts attempted
        int deliveries,            // successful per-subscription sends
        int ledgerEntriesWritten) {

    public static CheckResult skipped(String reason) {
        return new CheckResult(true, reason, 0, 0, 0, 0);
    }

    public static CheckResult nothingDue() {
        return new CheckResult(false, null, 0, 0, 0, 0);
    }
}
