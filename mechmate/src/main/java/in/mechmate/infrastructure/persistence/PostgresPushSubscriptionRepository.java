package in.mechmate.infrastructure.persistence;

import in.mechmate.application.port.output.PushSubscriptionRepository;
import in.mechmate.application.port.output.RepositoryException;
import in.mechmate.domain.model.PushSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of PushSubscriptionRepository.
 *
 * ENFORCEMENT:
 * - Unique constraint: (endpoint)
 */
public final class PostgresPushSubscriptionRepository implements PushSubscriptionRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresPushSubscriptionRepository.class);

    private final DataSource dataSource;

    public PostgresPushSubscriptionRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<PushSubscription> findAll() {
        String sql = "SELECT * FROM notification_subscriptions ORDER BY created_at DESC";

        List<PushSubscription> subscriptions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                subscriptions.add(mapRow(rs));
            }
        } catch (SQLException e) {
            log.error("Failed to list subscriptions: {}", e.getMessage());
            throw new RepositoryException("Failed to list subscriptions", e);
        }
        return subscriptions;
    }

    @Override
    public Optional<PushSubscription> findByEndpoint(String endpoint) {
        String sql = "SELECT * FROM notification_subscriptions WHERE endpoint = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, endpoint);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find subscription by endpoint: {}", e.getMessage());
            throw new RepositoryException("Failed to find subscription", e);
        }
        return Optional.empty();
    }

    @Override
    public PushSubscription create(String endpoint, String p256dhKey, String authKey, String userAgent) {
        String sql = """
                INSERT INTO notification_subscriptions (endpoint, p256dh_key, auth_key, user_agent, created_at, last_used_at)
                VALUES (?, ?, ?, ?, NOW(), NOW())
                RETURNING *
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, endpoint);
            ps.setString(2, p256dhKey);
            ps.setString(3, authKey);
            ps.setString(4, userAgent);

            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                PushSubscription created = mapRow(rs);
                log.info("Subscription created: {}", created.id());
                return created;
            }
        } catch (SQLException e) {
            log.error("Failed to create subscription: {}", e.getMessage());
            throw new RepositoryException("Failed to create subscription", e);
        }
    }

    @Override
    public void touch(long id) {
        String sql = "UPDATE notification_subscriptions SET last_used_at = NOW() WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to update last_used_at for subscription {}: {}", id, e.getMessage());
            throw new RepositoryException("Failed to update subscription", e);
        }
    }

    @Override
    public boolean deleteById(long id) {
        String sql = "DELETE FROM notification_subscriptions WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            log.error("Failed to delete subscription {}: {}", id, e.getMessage());
            throw new RepositoryException("Failed to delete subscription", e);
        }
    }

    @Override
    public boolean deleteByEndpoint(String endpoint) {
        String sql = "DELETE FROM notification_subscriptions WHERE endpoint = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, endpoint);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            log.error("Failed to delete subscription by endpoint: {}", e.getMessage());
            throw new RepositoryException("Failed to delete subscription", e);
        }
    }

    private PushSubscription mapRow(ResultSet rs) throws SQLException {
        Timestamp lastUsed = rs.getTimestamp("last_used_at");
        return new PushSubscription(
                rs.getLong("id"),
                rs.getString("endpoint"),
                rs.getString("p256dh_key"),
                rs.getString("auth_key"),
                rs.getString("user_agent"),
                rs.getTimestamp("created_at").toInstant(),
                lastUsed != null ? lastUsed.toInstant() : null);
    }
}
