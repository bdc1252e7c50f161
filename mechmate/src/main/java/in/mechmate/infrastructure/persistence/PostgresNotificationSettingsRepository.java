package in.mechmate.infrastructure.persistence;

import in.mechmate.application.port.output.NotificationSettingsRepository;
import in.mechmate.application.port.output.RepositoryException;
import in.mechmate.domain.model.NotificationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * PostgreSQL implementation of NotificationSettingsRepository.
 *
 * Single-instance deployment: the settings row always has id = 1.
 */
public final class PostgresNotificationSettingsRepository implements NotificationSettingsRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresNotificationSettingsRepository.class);

    static final long SETTINGS_ID = 1L;

    private final DataSource dataSource;

    public PostgresNotificationSettingsRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<NotificationSettings> getSettings() {
        String sql = "SELECT * FROM notification_settings WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, SETTINGS_ID);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to get notification settings: {}", e.getMessage());
            throw new RepositoryException("Failed to get notification settings", e);
        }
        return Optional.empty();
    }

    @Override
    public NotificationSettings update(NotificationSettings settings) {
        String sql = """
                INSERT INTO notification_settings (
                    id, enabled,
                    threshold_1_month, threshold_2_weeks, threshold_1_week,
                    threshold_3_days, threshold_1_day, threshold_due_date, threshold_overdue_daily,
                    created_at, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, NOW(), NOW())
                ON CONFLICT (id) DO UPDATE SET
                    enabled = EXCLUDED.enabled,
                    threshold_1_month = EXCLUDED.threshold_1_month,
                    threshold_2_weeks = EXCLUDED.threshold_2_weeks,
                    threshold_1_week = EXCLUDED.threshold_1_week,
                    threshold_3_days = EXCLUDED.threshold_3_days,
                    threshold_1_day = EXCLUDED.threshold_1_day,
                    threshold_due_date = EXCLUDED.threshold_due_date,
                    threshold_overdue_daily = EXCLUDED.threshold_overdue_daily,
                    updated_at = NOW()
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, SETTINGS_ID);
            ps.setBoolean(2, settings.enabled());
            ps.setBoolean(3, settings.threshold1Month());
            ps.setBoolean(4, settings.threshold2Weeks());
            ps.setBoolean(5, settings.threshold1Week());
            ps.setBoolean(6, settings.threshold3Days());
            ps.setBoolean(7, settings.threshold1Day());
            ps.setBoolean(8, settings.thresholdDueDate());
            ps.setBoolean(9, settings.thresholdOverdueDaily());

            ps.executeUpdate();
            log.info("Notification settings updated: enabled={}", settings.enabled());
            return settings;

        } catch (SQLException e) {
            log.error("Failed to update notification settings: {}", e.getMessage());
            throw new RepositoryException("Failed to update notification settings", e);
        }
    }

    private NotificationSettings mapRow(ResultSet rs) throws SQLException {
        return new NotificationSettings(
                rs.getBoolean("enabled"),
                rs.getBoolean("threshold_1_month"),
                rs.getBoolean("threshold_2_weeks"),
                rs.getBoolean("threshold_1_week"),
                rs.getBoolean("threshold_3_days"),
                rs.getBoolean("threshold_1_day"),
                rs.getBoolean("threshold_due_date"),
                rs.getBoolean("threshold_overdue_daily"));
    }
}
