package in.mechmate.application.port.output;

import in.mechmate.domain.model.PushResult;

/**
 * Metrics sink for the notification engine.
 */
public interface NotificationMetrics {

    NotificationMetrics NOOP = new NotificationMetrics() {
        @Override public void recordCheck(boolean skipped) {}
        @Override public void recordCheckFailed() {}
        @Override public void recordDueTasks(int count) {}
        @Override public void recordPush(PushResult.Outcome outcome) {}
        @Override public void recordSubscriptionPruned() {}
        @Override public void recordLedgerWrite(boolean success) {}
    };

    void recordCheck(boolean skipped);

    /**
     * A run that ended with an exception.
     */
    void recordCheckFailed();

    void recordDueTasks(int count);

    void recordPush(PushResult.Outcome outcome);

    void recordSubscriptionPruned();

    void recordLedgerWrite(boolean success);
}
