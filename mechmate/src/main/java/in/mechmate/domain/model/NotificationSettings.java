package in.mechmate.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Global notification settings (single row, single-instance deployment).
 */
public record NotificationSettings(
    @JsonProperty("enabled")
    boolean enabled,

    @JsonProperty("threshold_1_month")
    boolean threshold1Month,

    @JsonProperty("threshold_2_weeks")
    boolean threshold2Weeks,

    @JsonProperty("threshold_1_week")
    boolean threshold1Week,

    @JsonProperty("threshold_3_days")
    boolean threshold3Days,

    @JsonProperty("threshold_1_day")
    boolean threshold1Day,

    @JsonProperty("threshold_due_date")
    boolean thresholdDueDate,

    @JsonProperty("threshold_overdue_daily")
    boolean thresholdOverdueDaily
) {
    /**
     * Seed row written by the schema migration.
     */
    public static NotificationSettings defaults() {
        return new NotificationSettings(
            true,
            false,  // 1 month
            false,  // 2 weeks
            true,   // 1 week
            false,  // 3 days
            true,   // 1 day
            true,   // due date
            true    // overdue daily
        );
    }

    @JsonIgnore
    public boolean isEnabled(ThresholdType type) {
        return switch (type) {
            case ONE_MONTH -> threshold1Month;
            case TWO_WEEKS -> threshold2Weeks;
            case ONE_WEEK -> threshold1Week;
            case THREE_DAYS -> threshold3Days;
            case ONE_DAY -> threshold1Day;
            case DUE_DATE -> thresholdDueDate;
            case OVERDUE_DAILY -> thresholdOverdueDaily;
        };
    }
}
