package com.fleetgate.store;

import com.fleetgate.store.model.PluginEvent;
import com.fleetgate.store.model.PluginInstance;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Plugins, plugin instances and the plugin audit trail.
 */
public class PluginRepository extends JdbcRepository {

    private static final String INSTANCE_COLUMNS = "id, plugin_id, type, name, enabled, config";

    public PluginRepository(Database database) {
        super(database);
    }

    public PluginInstance createInstance(PluginInstance instance) {
        if (instance.getId() == null) {
            instance.setId(UUID.randomUUID().toString());
        }
        long now = nowSeconds();
        database.transaction(conn -> {
            update(conn, "INSERT OR IGNORE INTO plugins(id, enabled, updated_at) VALUES(?, 1, ?)", ps -> {
                ps.setString(1, instance.getPluginId());
                ps.setLong(2, now);
            });
            return update(conn, "INSERT INTO plugin_instances(" + INSTANCE_COLUMNS + ", created_at)"
                    + " VALUES(?,?,?,?,?,?,?)", ps -> {
                ps.setString(1, instance.getId());
                ps.setString(2, instance.getPluginId());
                ps.setString(3, instance.getType());
                ps.setString(4, instance.getName());
                ps.setInt(5, instance.isEnabled() ? 1 : 0);
                ps.setString(6, instance.getConfig());
                ps.setLong(7, now);
            });
        });
        return instance;
    }

    public Optional<PluginInstance> findInstance(String id) {
        return database.withConnection(conn -> queryOne(conn,
                "SELECT " + INSTANCE_COLUMNS + " FROM plugin_instances WHERE id = ?",
                ps -> ps.setString(1, id), PluginRepository::mapInstance));
    }

    public void updateInstanceConfig(String id, String config) {
        database.withConnection(conn -> update(conn, "UPDATE plugin_instances SET config = ? WHERE id = ?", ps -> {
            ps.setString(1, config);
            ps.setString(2, id);
        }));
    }

    /**
     * Persisted enabled flag of a plugin. Unknown plugins count as enabled.
     */
    public boolean isPluginEnabled(String pluginId) {
        return database.withConnection(conn -> queryOne(conn, "SELECT enabled FROM plugins WHERE id = ?",
                ps -> ps.setString(1, pluginId), rs -> rs.getInt("enabled") == 1).orElse(true));
    }

    public void setPluginEnabled(String pluginId, boolean enabled) {
        database.withConnection(conn -> update(conn,
                "INSERT INTO plugins(id, enabled, updated_at) VALUES(?,?,?)"
                        + " ON CONFLICT(id) DO UPDATE SET enabled = excluded.enabled, updated_at = excluded.updated_at",
                ps -> {
                    ps.setString(1, pluginId);
                    ps.setInt(2, enabled ? 1 : 0);
                    ps.setLong(3, nowSeconds());
                }));
    }

    public PluginEvent createEvent(PluginEvent event) {
        if (event.getId() == null) {
            event.setId(UUID.randomUUID().toString());
        }
        event.setCreatedAt(nowSeconds());
        database.withConnection(conn -> update(conn,
                "INSERT INTO plugin_events(id, plugin_id, plugin_instance_id, kind, status, work_item_id, detail,"
                        + " created_at) VALUES(?,?,?,?,?,?,?,?)", ps -> {
                    ps.setString(1, event.getId());
                    ps.setString(2, event.getPluginId());
                    ps.setString(3, event.getPluginInstanceId());
                    ps.setString(4, event.getKind());
                    ps.setString(5, event.getStatus());
                    ps.setString(6, event.getWorkItemId());
                    ps.setString(7, event.getDetail());
                    ps.setLong(8, event.getCreatedAt());
                }));
        return event;
    }

    public List<PluginEvent> listEvents(String pluginId) {
        return database.withConnection(conn -> query(conn,
                "SELECT id, plugin_id, plugin_instance_id, kind, status, work_item_id, detail, created_at"
                        + " FROM plugin_events WHERE plugin_id = ? ORDER BY created_at, rowid",
                ps -> ps.setString(1, pluginId), rs -> PluginEvent.builder()
                        .id(rs.getString("id"))
                        .pluginId(rs.getString("plugin_id"))
                        .pluginInstanceId(rs.getString("plugin_instance_id"))
                        .kind(rs.getString("kind"))
                        .status(rs.getString("status"))
                        .workItemId(rs.getString("work_item_id"))
                        .detail(rs.getString("detail"))
                        .createdAt(rs.getLong("created_at"))
                        .build()));
    }

    private static PluginInstance mapInstance(ResultSet rs) throws SQLException {
        return PluginInstance.builder()
                .id(rs.getString("id"))
                .pluginId(rs.getString("plugin_id"))
                .type(rs.getString("type"))
                .name(rs.getString("name"))
                .enabled(rs.getInt("enabled") == 1)
                .config(rs.getString("config"))
                .build();
    }
}
