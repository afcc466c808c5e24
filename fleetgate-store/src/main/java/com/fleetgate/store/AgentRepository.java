package com.fleetgate.store;

import com.fleetgate.store.model.AgentRecord;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Agents and their assignment to plugin instances.
 */
public class AgentRepository extends JdbcRepository {

    public AgentRepository(Database database) {
        super(database);
    }

    public AgentRecord create(AgentRecord agent) {
        if (agent.getId() == null) {
            agent.setId(UUID.randomUUID().toString());
        }
        if (agent.getStatus() == null) {
            agent.setStatus("idle");
        }
        database.withConnection(conn -> update(conn,
                "INSERT INTO agents(id, handle, name, status, config, created_at) VALUES(?,?,?,?,?,?)", ps -> {
                    ps.setString(1, agent.getId());
                    ps.setString(2, agent.getHandle());
                    ps.setString(3, agent.getName());
                    ps.setString(4, agent.getStatus());
                    ps.setString(5, agent.getConfig());
                    ps.setLong(6, nowSeconds());
                }));
        return agent;
    }

    public Optional<AgentRecord> findById(String id) {
        return database.withConnection(conn -> queryOne(conn,
                "SELECT id, handle, name, status, config FROM agents WHERE id = ?",
                ps -> ps.setString(1, id), AgentRepository::map));
    }

    public void delete(String id) {
        database.transaction(conn -> {
            update(conn, "DELETE FROM agent_plugin_instances WHERE agent_id = ?", ps -> ps.setString(1, id));
            return update(conn, "DELETE FROM agents WHERE id = ?", ps -> ps.setString(1, id));
        });
    }

    public void assignToPluginInstance(String agentId, String pluginInstanceId, int position) {
        database.withConnection(conn -> update(conn,
                "INSERT OR REPLACE INTO agent_plugin_instances(agent_id, plugin_instance_id, position) VALUES(?,?,?)",
                ps -> {
                    ps.setString(1, agentId);
                    ps.setString(2, pluginInstanceId);
                    ps.setInt(3, position);
                }));
    }

    /**
     * Agents assigned to a plugin instance, in assignment order.
     */
    public List<AgentRecord> listForPluginInstance(String pluginInstanceId) {
        return database.withConnection(conn -> query(conn,
                "SELECT a.id, a.handle, a.name, a.status, a.config FROM agents a"
                        + " JOIN agent_plugin_instances api ON api.agent_id = a.id"
                        + " WHERE api.plugin_instance_id = ? ORDER BY api.position, a.handle",
                ps -> ps.setString(1, pluginInstanceId), AgentRepository::map));
    }

    private static AgentRecord map(ResultSet rs) throws SQLException {
        return AgentRecord.builder()
                .id(rs.getString("id"))
                .handle(rs.getString("handle"))
                .name(rs.getString("name"))
                .status(rs.getString("status"))
                .config(rs.getString("config"))
                .build();
    }
}
