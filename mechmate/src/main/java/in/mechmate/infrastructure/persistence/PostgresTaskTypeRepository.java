package in.mechmate.infrastructure.persistence;

import in.mechmate.application.port.output.RepositoryException;
import in.mechmate.application.port.output.TaskTypeRepository;
import in.mechmate.domain.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * PostgreSQL implementation of TaskTypeRepository (read-only).
 */
public final class PostgresTaskTypeRepository implements TaskTypeRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresTaskTypeRepository.class);

    private final DataSource dataSource;

    public PostgresTaskTypeRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<TaskType> findById(long taskTypeId) {
        String sql = "SELECT id, name FROM task_types WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskTypeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new TaskType(rs.getLong("id"), rs.getString("name")));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find task type {}: {}", taskTypeId, e.getMessage());
            throw new RepositoryException("Failed to find task type", e);
        }
        return Optional.empty();
    }
}
