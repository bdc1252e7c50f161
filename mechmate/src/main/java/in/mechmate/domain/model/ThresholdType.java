package in.mechmate.domain.model;

/**
 * Named rule describing when, relative to a task's due date, a notification fires.
 *
 * Lead-time thresholds match exactly one day offset. OVERDUE_DAILY matches every
 * day the task is past due.
 */
public enum ThresholdType {
    ONE_MONTH("1_month", 30),
    TWO_WEEKS("2_weeks", 14),
    ONE_WEEK("1_week", 7),
    THREE_DAYS("3_days", 3),
    ONE_DAY("1_day", 1),
    DUE_DATE("due_date", 0),
    OVERDUE_DAILY("overdue_daily", -1);

    private final String code;
    private final int leadDays;

    ThresholdType(String code, int leadDays) {
        this.code = code;
        this.leadDays = leadDays;
    }

    /**
     * Storage code used in the notification log.
     */
    public String getCode() {
        return code;
    }

    /**
     * Days before the due date at which this threshold fires.
     * Meaningless for OVERDUE_DAILY.
     */
    public int getLeadDays() {
        return leadDays;
    }

    /**
     * Does a task due in {@code daysUntilDue} days satisfy this threshold?
     */
    public boolean matches(long daysUntilDue) {
        if (this == OVERDUE_DAILY) {
            return daysUntilDue < 0;
        }
        return daysUntilDue == getLeadDays();
    }
}
