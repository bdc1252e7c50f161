package in.mechmate.migration;

import in.mechmate.domain.model.NotificationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Notification Schema Migration - Creates notification tables on startup.
 *
 * Creates three tables:
 * - notification_subscriptions: browser push subscriptions
 * - notification_settings: global settings (single row, seeded with defaults)
 * - notification_log: dedup ledger
 *
 * The equipment, task_types and tasks tables are owned by the maintenance
 * management schema and are not touched here.
 */
public final class NotificationSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(NotificationSchemaMigration.class);

    private final DataSource dataSource;

    public NotificationSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates tables if they don't exist.
     */
    public void migrate() {
        log.info("[NOTIFY MIGRATION] Starting notification tables migration");

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, "notification_subscriptions")) {
                log.info("[NOTIFY MIGRATION] Creating notification_subscriptions table...");
                createSubscriptionsTable(conn);
                log.info("[NOTIFY MIGRATION] ✓ notification_subscriptions table created");
            } else {
                log.info("[NOTIFY MIGRATION] notification_subscriptions table already exists");
            }

            if (!tableExists(conn, "notification_settings")) {
                log.info("[NOTIFY MIGRATION] Creating notification_settings table...");
                createSettingsTable(conn);
                insertDefaultSettings(conn);
                log.info("[NOTIFY MIGRATION] ✓ notification_settings table created");
            } else {
                log.info("[NOTIFY MIGRATION] notification_settings table already exists");
            }

            if (!tableExists(conn, "notification_log")) {
                log.info("[NOTIFY MIGRATION] Creating notification_log table...");
                createLogTable(conn);
                log.info("[NOTIFY MIGRATION] ✓ notification_log table created");
            } else {
                log.info("[NOTIFY MIGRATION] notification_log table already exists");
            }

            log.info("[NOTIFY MIGRATION] Migration completed successfully");

        } catch (Exception e) {
            log.error("[NOTIFY MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Notification migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createSubscriptionsTable(Connection conn) throws Exception {
        String sql = """
            CREATE TABLE notification_subscriptions (
                id BIGSERIAL PRIMARY KEY,
                endpoint TEXT NOT NULL UNIQUE,
                p256dh_key TEXT NOT NULL,
                auth_key TEXT NOT NULL,
                user_agent TEXT,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                last_used_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """;
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private void createSettingsTable(Connection conn) throws Exception {
        String sql = """
            CREATE TABLE notification_settings (
                id BIGINT PRIMARY KEY,
                enabled BOOLEAN NOT NULL DEFAULT TRUE,
                threshold_1_month BOOLEAN NOT NULL DEFAULT FALSE,
                threshold_2_weeks BOOLEAN NOT NULL DEFAULT FALSE,
                threshold_1_week BOOLEAN NOT NULL DEFAULT TRUE,
                threshold_3_days BOOLEAN NOT NULL DEFAULT FALSE,
                threshold_1_day BOOLEAN NOT NULL DEFAULT TRUE,
                threshold_due_date BOOLEAN NOT NULL DEFAULT TRUE,
                threshold_overdue_daily BOOLEAN NOT NULL DEFAULT TRUE,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """;
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private void insertDefaultSettings(Connection conn) throws Exception {
        NotificationSettings defaults = NotificationSettings.defaults();
        String sql = """
            INSERT INTO notification_settings (
                id, enabled,
                threshold_1_month, threshold_2_weeks, threshold_1_week,
                threshold_3_days, threshold_1_day, threshold_due_date, threshold_overdue_daily
            ) VALUES (1, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setBoolean(1, defaults.enabled());
            ps.setBoolean(2, defaults.threshold1Month());
            ps.setBoolean(3, defaults.threshold2Weeks());
            ps.setBoolean(4, defaults.threshold1Week());
            ps.setBoolean(5, defaults.threshold3Days());
            ps.setBoolean(6, defaults.threshold1Day());
            ps.setBoolean(7, defaults.thresholdDueDate());
            ps.setBoolean(8, defaults.thresholdOverdueDaily());
            ps.executeUpdate();
        }
        log.info("[NOTIFY MIGRATION] ✓ Default notification settings inserted");
    }

    private void createLogTable(Connection conn) throws Exception {
        String sql = """
            CREATE TABLE notification_log (
                id BIGSERIAL PRIMARY KEY,
                task_id BIGINT NOT NULL REFERENCES tasks(id) ON DELETE CASCADE,
                threshold_type VARCHAR(20) NOT NULL,
                notification_date DATE NOT NULL,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """;
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("""
                CREATE INDEX idx_notification_log_task_threshold
                    ON notification_log (task_id, threshold_type, notification_date)
                """);
        }
    }
}
