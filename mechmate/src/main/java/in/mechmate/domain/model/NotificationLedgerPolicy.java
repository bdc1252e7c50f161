package in.mechmate.domain.model;

/**
 * When a notified due task is written to the dedup ledger.
 */
public enum NotificationLedgerPolicy {
    /** Record after every broadcast attempt, even if no device received it. */
    ATTEMPTED,
    /** Record only when the broadcast reached at least one subscription. */
    DELIVERED;

    public boolean shouldRecord(int successfulDeliveries) {
        return this == ATTEMPTED || successfulDeliveries > 0;
    }
}
