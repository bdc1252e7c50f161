package in.mechmate.infrastructure.persistence;

import in.mechmate.application.port.output.NotificationLogRepository;
import in.mechmate.application.port.output.RepositoryException;
import in.mechmate.domain.model.NotificationLogEntry;
import in.mechmate.domain.model.ThresholdType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.time.LocalDate;

/**
 * PostgreSQL implementation of NotificationLogRepository.
 *
 * Index: (task_id, threshold_type, notification_date) backs the dedup lookup.
 */
public final class PostgresNotificationLogRepository implements NotificationLogRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresNotificationLogRepository.class);

    private final DataSource dataSource;

    public PostgresNotificationLogRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean hasBeenSent(long taskId, ThresholdType thresholdType, LocalDate notificationDate) {
        String sql = """
                SELECT 1 FROM notification_log
                WHERE task_id = ? AND threshold_type = ? AND notification_date = ?
                LIMIT 1
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskId);
            ps.setString(2, thresholdType.getCode());
            ps.setDate(3, Date.valueOf(notificationDate));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.error("Failed to check notification log for task {} ({}): {}",
                    taskId, thresholdType.getCode(), e.getMessage());
            throw new RepositoryException("Failed to check notification log", e);
        }
    }

    @Override
    public NotificationLogEntry append(long taskId, ThresholdType thresholdType, LocalDate notificationDate) {
        String sql = """
                INSERT INTO notification_log (task_id, threshold_type, notification_date, created_at)
                VALUES (?, ?, ?, NOW())
                RETURNING id, created_at
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskId);
            ps.setString(2, thresholdType.getCode());
            ps.setDate(3, Date.valueOf(notificationDate));

            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                NotificationLogEntry entry = new NotificationLogEntry(
                        rs.getLong("id"),
                        taskId,
                        thresholdType,
                        notificationDate,
                        rs.getTimestamp("created_at").toInstant());
                log.debug("Notification logged: task {} {} on {}", taskId, thresholdType.getCode(), notificationDate);
                return entry;
            }
        } catch (SQLException e) {
            log.error("Failed to log notification for task {} ({}): {}",
                    taskId, thresholdType.getCode(), e.getMessage());
            throw new RepositoryException("Failed to log notification", e);
        }
    }

    @Override
    public int deleteCreatedBefore(Instant cutoff) {
        String sql = "DELETE FROM notification_log WHERE created_at < ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            return ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to purge notification log before {}: {}", cutoff, e.getMessage());
            throw new RepositoryException("Failed to purge notification log", e);
        }
    }
}
