package com.fleetgate.store;

import com.fleetgate.store.model.WorkItem;
import com.fleetgate.store.model.WorkItemStatus;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Work items, their idempotency keys and their downstream event envelopes.
 */
@Slf4j
public class WorkItemRepository extends JdbcRepository {

    private static final String COLUMNS = "id, source, source_ref, plugin_instance_id, session_key, status,"
            + " title, payload, created_at, updated_at";

    public WorkItemRepository(Database database) {
        super(database);
    }

    /**
     * Insert a work item. Missing id and status are filled in ({@code NEW}).
     *
     * @throws SQLException including a constraint violation when {@code (source, source_ref)} exists
     */
    public WorkItem create(Connection conn, WorkItem item) throws SQLException {
        long now = nowSeconds();
        if (item.getId() == null) {
            item.setId(UUID.randomUUID().toString());
        }
        if (item.getStatus() == null) {
            item.setStatus(WorkItemStatus.NEW);
        }
        item.setCreatedAt(now);
        item.setUpdatedAt(now);
        update(conn, "INSERT INTO work_items(" + COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?)", ps -> {
            ps.setString(1, item.getId());
            ps.setString(2, item.getSource());
            ps.setString(3, item.getSourceRef());
            ps.setString(4, item.getPluginInstanceId());
            ps.setString(5, item.getSessionKey());
            ps.setString(6, item.getStatus().name());
            ps.setString(7, item.getTitle());
            ps.setString(8, item.getPayload());
            ps.setLong(9, now);
            ps.setLong(10, now);
        });
        return item;
    }

    public Optional<WorkItem> findById(String id) {
        return database.withConnection(conn -> queryOne(conn,
                "SELECT " + COLUMNS + " FROM work_items WHERE id = ?",
                ps -> ps.setString(1, id), WorkItemRepository::map));
    }

    public Optional<WorkItem> findBySourceRef(String source, String sourceRef) {
        return database.withConnection(conn -> findBySourceRef(conn, source, sourceRef));
    }

    public Optional<WorkItem> findBySourceRef(Connection conn, String source, String sourceRef) throws SQLException {
        return queryOne(conn, "SELECT " + COLUMNS + " FROM work_items WHERE source = ? AND source_ref = ?",
                ps -> {
                    ps.setString(1, source);
                    ps.setString(2, sourceRef);
                }, WorkItemRepository::map);
    }

    public List<WorkItem> listBySource(String source) {
        return database.withConnection(conn -> query(conn,
                "SELECT " + COLUMNS + " FROM work_items WHERE source = ? ORDER BY created_at, rowid",
                ps -> ps.setString(1, source), WorkItemRepository::map));
    }

    public List<WorkItem> listBySessionKey(String sessionKey) {
        return database.withConnection(conn -> query(conn,
                "SELECT " + COLUMNS + " FROM work_items WHERE session_key = ? ORDER BY created_at, rowid",
                ps -> ps.setString(1, sessionKey), WorkItemRepository::map));
    }

    public int count() {
        return database.withConnection(conn -> queryOne(conn, "SELECT COUNT(*) AS n FROM work_items",
                ps -> { }, rs -> rs.getInt("n")).orElse(0));
    }

    public void updateStatus(String id, WorkItemStatus status) {
        database.withConnection(conn -> update(conn,
                "UPDATE work_items SET status = ?, updated_at = ? WHERE id = ?", ps -> {
                    ps.setString(1, status.name());
                    ps.setLong(2, nowSeconds());
                    ps.setString(3, id);
                }));
    }

    /**
     * Find the work item already recorded under any of the given keys.
     */
    public Optional<String> findWorkItemIdByIdempotencyKeys(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return Optional.empty();
        }
        return database.withConnection(conn -> {
            for (String key : keys) {
                Optional<String> found = queryOne(conn,
                        "SELECT work_item_id FROM idempotency_keys WHERE key = ?",
                        ps -> ps.setString(1, key), rs -> rs.getString("work_item_id"));
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        });
    }

    /**
     * Record idempotency keys for a work item. Keys already claimed by another delivery
     * are left untouched.
     */
    public void insertIdempotencyKeys(Connection conn, String workItemId, Collection<String> keys) throws SQLException {
        long now = nowSeconds();
        for (String key : keys) {
            update(conn, "INSERT OR IGNORE INTO idempotency_keys(key, work_item_id, created_at) VALUES(?,?,?)", ps -> {
                ps.setString(1, key);
                ps.setString(2, workItemId);
                ps.setLong(3, now);
            });
        }
    }

    /**
     * Append a downstream event envelope for a work item.
     */
    public void appendEvent(String workItemId, String kind, String envelope) {
        database.withConnection(conn -> update(conn,
                "INSERT INTO work_item_events(id, work_item_id, kind, envelope, created_at) VALUES(?,?,?,?,?)", ps -> {
                    ps.setString(1, UUID.randomUUID().toString());
                    ps.setString(2, workItemId);
                    ps.setString(3, kind);
                    ps.setString(4, envelope);
                    ps.setLong(5, nowSeconds());
                }));
    }

    public int countEvents(String workItemId) {
        return database.withConnection(conn -> queryOne(conn,
                "SELECT COUNT(*) AS n FROM work_item_events WHERE work_item_id = ?",
                ps -> ps.setString(1, workItemId), rs -> rs.getInt("n")).orElse(0));
    }

    private static WorkItem map(ResultSet rs) throws SQLException {
        return WorkItem.builder()
                .id(rs.getString("id"))
                .source(rs.getString("source"))
                .sourceRef(rs.getString("source_ref"))
                .pluginInstanceId(rs.getString("plugin_instance_id"))
                .sessionKey(rs.getString("session_key"))
                .status(WorkItemStatus.valueOf(rs.getString("status")))
                .title(rs.getString("title"))
                .payload(rs.getString("payload"))
                .createdAt(rs.getLong("created_at"))
                .updatedAt(rs.getLong("updated_at"))
                .build();
    }
}
