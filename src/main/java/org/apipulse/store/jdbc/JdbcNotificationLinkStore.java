package org.apipulse.store.jdbc;

import org.apipulse.model.Integration;
import org.apipulse.model.IntegrationType;
import org.apipulse.model.NotificationLink;
import org.apipulse.model.NotifyOn;
import org.apipulse.store.NotificationLinkStore;
import org.apipulse.store.PersistenceException;
import org.apipulse.utils.JsonUtil;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.apipulse.store.jdbc.JdbcSupport.getUuid;

public class JdbcNotificationLinkStore implements NotificationLinkStore {

    private static final String INTEGRATION_COLUMNS =
            "i.id AS integration_id, i.user_id, i.integration_type, i.name, i.credentials, i.is_active";

    private final DataSource dataSource;

    public JdbcNotificationLinkStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<NotificationLink> findByTask(UUID taskId) {
        String sql = "SELECT n.id, n.task_id, n.notify_on, n.include_response, " + INTEGRATION_COLUMNS
                + " FROM task_notifications n"
                + " JOIN user_integrations i ON i.id = n.integration_id"
                + " WHERE n.task_id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, taskId);
            List<NotificationLink> links = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    links.add(mapLink(rs));
                }
            }
            return links;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load notification links of task " + taskId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Integration> findIntegration(UUID integrationId) {
        String sql = "SELECT " + INTEGRATION_COLUMNS + " FROM user_integrations i WHERE i.id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, integrationId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapIntegration(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load integration " + integrationId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public NotificationLink upsert(UUID taskId, UUID integrationId, NotifyOn notifyOn, boolean includeResponse) {
        String sql = """
                INSERT INTO task_notifications (task_id, integration_id, notify_on, include_response)
                VALUES (?, ?, ?, ?)
                ON CONFLICT (task_id, integration_id)
                DO UPDATE SET notify_on = EXCLUDED.notify_on, include_response = EXCLUDED.include_response
                RETURNING id
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, taskId);
            ps.setObject(2, integrationId);
            ps.setString(3, notifyOn.code());
            ps.setBoolean(4, includeResponse);

            UUID linkId;
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                linkId = getUuid(rs, "id");
            }
            Integration integration = findIntegration(integrationId)
                    .orElseThrow(() -> new PersistenceException("Integration " + integrationId + " vanished during link upsert"));
            return new NotificationLink(linkId, taskId, integration, notifyOn, includeResponse);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to link task " + taskId + " to integration " + integrationId
                    + ": " + e.getMessage(), e);
        }
    }

    private static NotificationLink mapLink(ResultSet rs) throws SQLException {
        return new NotificationLink(
                getUuid(rs, "id"),
                getUuid(rs, "task_id"),
                mapIntegration(rs),
                NotifyOn.fromCode(rs.getString("notify_on")),
                rs.getBoolean("include_response")
        );
    }

    private static Integration mapIntegration(ResultSet rs) throws SQLException {
        try {
            return new Integration(
                    getUuid(rs, "integration_id"),
                    getUuid(rs, "user_id"),
                    IntegrationType.fromCode(rs.getString("integration_type")),
                    rs.getString("name"),
                    JsonUtil.readStringMap(rs.getString("credentials")),
                    rs.getBoolean("is_active")
            );
        } catch (IOException e) {
            throw new SQLException("Malformed credentials on integration row: " + e.getMessage(), e);
        }
    }
}
