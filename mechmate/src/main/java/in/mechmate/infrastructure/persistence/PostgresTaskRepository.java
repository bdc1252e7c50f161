package in.mechmate.infrastructure.persistence;

import in.mechmate.application.port.output.RepositoryException;
import in.mechmate.application.port.output.TaskRepository;
import in.mechmate.domain.model.Task;
import in.mechmate.domain.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of TaskRepository.
 *
 * READ-ONLY: the tasks table belongs to the equipment/task management layer.
 */
public final class PostgresTaskRepository implements TaskRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresTaskRepository.class);

    private final DataSource dataSource;

    public PostgresTaskRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Task> findAllPending() {
        String sql = """
                SELECT id, equipment_id, task_type_id, title, status,
                       usage_interval, time_interval_days, next_due_date, next_due_usage_value
                FROM tasks
                WHERE status = 'pending'
                ORDER BY next_due_date ASC NULLS LAST, id ASC
                """;

        List<Task> tasks = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                tasks.add(mapRow(rs));
            }
        } catch (SQLException e) {
            log.error("Failed to find pending tasks: {}", e.getMessage());
            throw new RepositoryException("Failed to find pending tasks", e);
        }
        return tasks;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        Date nextDueDate = rs.getDate("next_due_date");
        int timeIntervalDays = rs.getInt("time_interval_days");
        boolean timeIntervalNull = rs.wasNull();

        return new Task(
                rs.getLong("id"),
                rs.getLong("equipment_id"),
                rs.getLong("task_type_id"),
                rs.getString("title"),
                TaskStatus.fromDb(rs.getString("status")),
                rs.getBigDecimal("usage_interval"),
                timeIntervalNull ? null : timeIntervalDays,
                nextDueDate != null ? nextDueDate.toLocalDate() : null,
                rs.getBigDecimal("next_due_usage_value"));
    }
}
