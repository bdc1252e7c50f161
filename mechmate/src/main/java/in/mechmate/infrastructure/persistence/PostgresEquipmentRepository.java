package in.mechmate.infrastructure.persistence;

import in.mechmate.application.port.output.EquipmentRepository;
import in.mechmate.application.port.output.RepositoryException;
import in.mechmate.domain.model.Equipment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * PostgreSQL implementation of EquipmentRepository (read-only).
 */
public final class PostgresEquipmentRepository implements EquipmentRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresEquipmentRepository.class);

    private final DataSource dataSource;

    public PostgresEquipmentRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<Equipment> findById(long equipmentId) {
        String sql = "SELECT id, name, usage_unit FROM equipment WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, equipmentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Equipment(
                            rs.getLong("id"),
                            rs.getString("name"),
                            rs.getString("usage_unit")));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find equipment {}: {}", equipmentId, e.getMessage());
            throw new RepositoryException("Failed to find equipment", e);
        }
        return Optional.empty();
    }
}
