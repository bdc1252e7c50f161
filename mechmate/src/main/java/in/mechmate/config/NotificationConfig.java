package in.mechmate.config;

import in.mechmate.domain.model.NotificationLedgerPolicy;
import in.mechmate.util.Env;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Process configuration, read once at startup from the environment.
 */
public record NotificationConfig(
    int httpPort,
    String dbUrl,
    String dbUser,
    String dbPassword,
    int dbPoolSize,
    String vapidPublicKey,      // nullable
    String vapidPrivateKey,     // nullable
    String vapidSubject,
    Duration checkInterval,
    NotificationLedgerPolicy ledgerPolicy,
    int logRetentionDays,
    Duration pushTimeout,
    ZoneId zone
) {
    public static final String DEFAULT_VAPID_SUBJECT = "mailto:noreply@mechmate.local";

    /**
     * @throws IllegalStateException if a variable is set to an unparseable value
     */
    public static NotificationConfig fromEnv() {
        return new NotificationConfig(
            Env.getInt("PORT", 9090),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/mechmate"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 5),
            Env.get("VAPID_PUBLIC_KEY", null),
            Env.get("VAPID_PRIVATE_KEY", null),
            Env.get("VAPID_SUBJECT", DEFAULT_VAPID_SUBJECT),
            Env.getDuration("NOTIFICATION_CHECK_INTERVAL_MINUTES", ChronoUnit.MINUTES, 60),
            parsePolicy(Env.get("NOTIFICATION_LEDGER_POLICY", NotificationLedgerPolicy.ATTEMPTED.name())),
            Env.getInt("NOTIFICATION_LOG_RETENTION_DAYS", 90),
            Env.getDuration("PUSH_TIMEOUT_SECONDS", ChronoUnit.SECONDS, 10),
            Env.getZone("TZ", ZoneOffset.UTC)
        );
    }

    /**
     * Fail fast on values that would make the scheduler misbehave.
     *
     * @throws IllegalStateException if the configuration is unusable
     */
    public void validate() {
        if (httpPort <= 0 || httpPort > 65535) {
            throw new IllegalStateException("PORT out of range: " + httpPort);
        }
        if (checkInterval.isZero() || checkInterval.isNegative()) {
            throw new IllegalStateException("NOTIFICATION_CHECK_INTERVAL_MINUTES must be positive");
        }
        if (pushTimeout.isZero() || pushTimeout.isNegative()) {
            throw new IllegalStateException("PUSH_TIMEOUT_SECONDS must be positive");
        }
    }

    static NotificationLedgerPolicy parsePolicy(String value) {
        try {
            return NotificationLedgerPolicy.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown NOTIFICATION_LEDGER_POLICY: " + value, e);
        }
    }
}
