package com.fleetgate.store;

import com.fleetgate.store.model.ScheduledItem;
import com.fleetgate.store.model.ScheduledItemStatus;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Scheduled items and the conditional state transitions that give exactly one worker
 * ownership of an item: {@code pending → firing → fired}, with release and stale
 * recovery back to {@code pending}.
 */
public class ScheduledItemRepository extends JdbcRepository {

    private static final String COLUMNS = "id, agent_id, session_key, type, payload, run_at, recurrence, status,"
            + " source_ref, plugin_instance_id, response_context, routine_id, routine_run_id, created_at,"
            + " fired_at, cancelled_at";

    public ScheduledItemRepository(Database database) {
        super(database);
    }

    public ScheduledItem create(ScheduledItem item) {
        if (item.getId() == null) {
            item.setId(UUID.randomUUID().toString());
        }
        item.setStatus(ScheduledItemStatus.PENDING);
        item.setCreatedAt(nowSeconds());
        database.withConnection(conn -> update(conn,
                "INSERT INTO scheduled_items(" + COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)", ps -> {
                    ps.setString(1, item.getId());
                    ps.setString(2, item.getAgentId());
                    ps.setString(3, item.getSessionKey());
                    ps.setString(4, item.getType());
                    ps.setString(5, item.getPayload());
                    ps.setLong(6, item.getRunAt());
                    ps.setString(7, item.getRecurrence());
                    ps.setString(8, item.getStatus().dbValue());
                    ps.setString(9, item.getSourceRef());
                    ps.setString(10, item.getPluginInstanceId());
                    ps.setString(11, item.getResponseContext());
                    ps.setString(12, item.getRoutineId());
                    ps.setString(13, item.getRoutineRunId());
                    ps.setLong(14, item.getCreatedAt());
                    setNullableLong(ps, 15, null);
                    setNullableLong(ps, 16, null);
                }));
        return item;
    }

    public Optional<ScheduledItem> findById(String id) {
        return database.withConnection(conn -> queryOne(conn,
                "SELECT " + COLUMNS + " FROM scheduled_items WHERE id = ?",
                ps -> ps.setString(1, id), ScheduledItemRepository::map));
    }

    /**
     * Pending items whose {@code run_at} is at or before {@code nowSeconds}, oldest first.
     */
    public List<ScheduledItem> listDue(long nowSeconds) {
        return database.withConnection(conn -> query(conn,
                "SELECT " + COLUMNS + " FROM scheduled_items WHERE status = 'pending' AND run_at <= ?"
                        + " ORDER BY run_at, created_at",
                ps -> ps.setLong(1, nowSeconds), ScheduledItemRepository::map));
    }

    /**
     * Conditional {@code pending → firing}.
     *
     * @return {@code true} if this caller now owns the item
     */
    public boolean claim(String id, long nowSeconds) {
        return database.withConnection(conn -> update(conn,
                "UPDATE scheduled_items SET status = 'firing', fired_at = ? WHERE id = ? AND status = 'pending'",
                ps -> {
                    ps.setLong(1, nowSeconds);
                    ps.setString(2, id);
                })) == 1;
    }

    /**
     * Conditional {@code firing → fired} on the caller's connection.
     *
     * @return the fired item, or empty when the item was not in {@code firing}
     */
    public Optional<ScheduledItem> confirmFired(Connection conn, String id) throws SQLException {
        int updated = update(conn, "UPDATE scheduled_items SET status = 'fired' WHERE id = ? AND status = 'firing'",
                ps -> ps.setString(1, id));
        if (updated != 1) {
            return Optional.empty();
        }
        return queryOne(conn, "SELECT " + COLUMNS + " FROM scheduled_items WHERE id = ?",
                ps -> ps.setString(1, id), ScheduledItemRepository::map);
    }

    public Optional<ScheduledItem> confirmFired(String id) {
        return database.withConnection(conn -> confirmFired(conn, id));
    }

    /**
     * Conditional {@code firing → pending}, clearing {@code fired_at}.
     */
    public boolean release(String id) {
        return database.withConnection(conn -> update(conn,
                "UPDATE scheduled_items SET status = 'pending', fired_at = NULL WHERE id = ? AND status = 'firing'",
                ps -> ps.setString(1, id))) == 1;
    }

    /**
     * Reset items left in {@code firing} for longer than {@code thresholdSeconds}.
     *
     * @return number of recovered items
     */
    public int recoverStaleFiringItems(long thresholdSeconds, long nowSeconds) {
        long cutoff = nowSeconds - thresholdSeconds;
        return database.withConnection(conn -> update(conn,
                "UPDATE scheduled_items SET status = 'pending', fired_at = NULL"
                        + " WHERE status = 'firing' AND (fired_at IS NULL OR fired_at <= ?)",
                ps -> ps.setLong(1, cutoff)));
    }

    /**
     * Cancel an item. A pending item becomes {@code cancelled}; an item that is already
     * firing keeps its status and only records {@code cancelled_at}, so it fires once.
     *
     * @return {@code true} if the item was pending or firing
     */
    public boolean markCancelled(String id, long nowSeconds) {
        return database.withConnection(conn -> update(conn,
                "UPDATE scheduled_items SET cancelled_at = ?,"
                        + " status = CASE WHEN status = 'pending' THEN 'cancelled' ELSE status END"
                        + " WHERE id = ? AND status IN ('pending', 'firing')",
                ps -> {
                    ps.setLong(1, nowSeconds);
                    ps.setString(2, id);
                })) == 1;
    }

    private static ScheduledItem map(ResultSet rs) throws SQLException {
        return ScheduledItem.builder()
                .id(rs.getString("id"))
                .agentId(rs.getString("agent_id"))
                .sessionKey(rs.getString("session_key"))
                .type(rs.getString("type"))
                .payload(rs.getString("payload"))
                .runAt(rs.getLong("run_at"))
                .recurrence(rs.getString("recurrence"))
                .status(ScheduledItemStatus.fromDb(rs.getString("status")))
                .sourceRef(rs.getString("source_ref"))
                .pluginInstanceId(rs.getString("plugin_instance_id"))
                .responseContext(rs.getString("response_context"))
                .routineId(rs.getString("routine_id"))
                .routineRunId(rs.getString("routine_run_id"))
                .createdAt(rs.getLong("created_at"))
                .firedAt(getNullableLong(rs, "fired_at"))
                .cancelledAt(getNullableLong(rs, "cancelled_at"))
                .build();
    }
}
