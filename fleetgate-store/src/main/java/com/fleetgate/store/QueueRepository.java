package com.fleetgate.store;

import com.fleetgate.store.model.QueueLaneRecord;
import com.fleetgate.store.model.QueueMessage;
import com.fleetgate.store.model.QueueMessageStatus;
import com.fleetgate.store.model.QueueMode;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable side of the session queues: lane rows and queue messages.
 */
public class QueueRepository extends JdbcRepository {

    private static final String MESSAGE_COLUMNS = "id, queue_key, work_item_id, plugin_instance_id, response_context,"
            + " text, sender_name, arrived_at, status, dispatch_id, drop_reason";
    private static final String LANE_COLUMNS = "queue_key, session_key, agent_id, plugin_instance_id, mode,"
            + " debounce_ms, max_queued";

    /**
     * Outcome of {@link #enqueueToLane}: the stored message and the lane as persisted,
     * whose mode may differ from the requested one when the lane already existed.
     */
    public record LaneEnqueue(QueueMessage message, QueueLaneRecord lane) {
    }

    public QueueRepository(Database database) {
        super(database);
    }

    /**
     * Insert a pending queue message and create or refresh its lane on the caller's
     * connection. The mode of an existing lane is kept; debounce and capacity follow the
     * latest settings.
     */
    public LaneEnqueue enqueueToLane(Connection conn, QueueLaneRecord lane, QueueMessage message) throws SQLException {
        long now = nowSeconds();
        if (message.getId() == null) {
            message.setId(UUID.randomUUID().toString());
        }
        message.setQueueKey(lane.getQueueKey());
        message.setStatus(QueueMessageStatus.PENDING);
        update(conn, "INSERT INTO queue_messages(" + MESSAGE_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?)", ps -> {
            ps.setString(1, message.getId());
            ps.setString(2, message.getQueueKey());
            ps.setString(3, message.getWorkItemId());
            ps.setString(4, message.getPluginInstanceId());
            ps.setString(5, message.getResponseContext());
            ps.setString(6, message.getText());
            ps.setString(7, message.getSenderName());
            ps.setLong(8, message.getArrivedAt());
            ps.setString(9, message.getStatus().dbValue());
            ps.setString(10, null);
            ps.setString(11, null);
        });

        Optional<QueueLaneRecord> existing = findLane(conn, lane.getQueueKey());
        if (existing.isEmpty()) {
            QueueMode mode = lane.getMode() != null ? lane.getMode() : QueueMode.STEER;
            update(conn, "INSERT INTO queue_lanes(" + LANE_COLUMNS + ", created_at, updated_at)"
                    + " VALUES(?,?,?,?,?,?,?,?,?)", ps -> {
                ps.setString(1, lane.getQueueKey());
                ps.setString(2, lane.getSessionKey());
                ps.setString(3, lane.getAgentId());
                ps.setString(4, lane.getPluginInstanceId());
                ps.setString(5, mode.dbValue());
                ps.setLong(6, lane.getDebounceMs());
                ps.setInt(7, lane.getMaxQueued());
                ps.setLong(8, now);
                ps.setLong(9, now);
            });
        } else {
            update(conn, "UPDATE queue_lanes SET session_key = ?, agent_id = ?, plugin_instance_id = ?,"
                    + " debounce_ms = ?, max_queued = ?, updated_at = ? WHERE queue_key = ?", ps -> {
                ps.setString(1, lane.getSessionKey());
                ps.setString(2, lane.getAgentId());
                ps.setString(3, lane.getPluginInstanceId());
                ps.setLong(4, lane.getDebounceMs());
                ps.setInt(5, lane.getMaxQueued());
                ps.setLong(6, now);
                ps.setString(7, lane.getQueueKey());
            });
        }
        QueueLaneRecord stored = findLane(conn, lane.getQueueKey())
                .orElseThrow(() -> new SQLException("Lane vanished during enqueue: " + lane.getQueueKey()));
        return new LaneEnqueue(message, stored);
    }

    public LaneEnqueue enqueueToLane(QueueLaneRecord lane, QueueMessage message) {
        return database.transaction(conn -> enqueueToLane(conn, lane, message));
    }

    public Optional<QueueLaneRecord> findLane(String queueKey) {
        return database.withConnection(conn -> findLane(conn, queueKey));
    }

    private Optional<QueueLaneRecord> findLane(Connection conn, String queueKey) throws SQLException {
        return queryOne(conn, "SELECT " + LANE_COLUMNS + " FROM queue_lanes WHERE queue_key = ?",
                ps -> ps.setString(1, queueKey), QueueRepository::mapLane);
    }

    /**
     * Mark pending messages as included in a dispatch.
     */
    public int markDispatched(Collection<String> messageIds, String dispatchId) {
        if (messageIds.isEmpty()) {
            return 0;
        }
        return database.transaction(conn -> {
            int total = 0;
            for (String id : messageIds) {
                total += update(conn, "UPDATE queue_messages SET status = 'dispatched', dispatch_id = ?"
                        + " WHERE id = ? AND status = 'pending'", ps -> {
                    ps.setString(1, dispatchId);
                    ps.setString(2, id);
                });
            }
            return total;
        });
    }

    /**
     * Drop a pending message. Its work item is canceled when it is still {@code NEW} and
     * no other lane holds a live message for it.
     */
    public boolean markDropped(String messageId, String reason) {
        return database.transaction(conn -> {
            int dropped = update(conn, "UPDATE queue_messages SET status = 'dropped', drop_reason = ?"
                    + " WHERE id = ? AND status = 'pending'", ps -> {
                ps.setString(1, reason);
                ps.setString(2, messageId);
            });
            if (dropped == 0) {
                return false;
            }
            update(conn, "UPDATE work_items SET status = 'CANCELED', updated_at = ?"
                    + " WHERE id = (SELECT work_item_id FROM queue_messages WHERE id = ?) AND status = 'NEW'"
                    + " AND NOT EXISTS (SELECT 1 FROM queue_messages m WHERE m.work_item_id = work_items.id"
                    + " AND m.status IN ('pending', 'dispatched'))", ps -> {
                ps.setLong(1, nowSeconds());
                ps.setString(2, messageId);
            });
            return true;
        });
    }

    /**
     * Return dispatched messages to pending so a later dispatch can claim them.
     */
    public int requeue(Collection<String> messageIds) {
        if (messageIds.isEmpty()) {
            return 0;
        }
        return database.transaction(conn -> {
            int total = 0;
            for (String id : messageIds) {
                total += update(conn, "UPDATE queue_messages SET status = 'pending', dispatch_id = NULL"
                        + " WHERE id = ? AND status = 'dispatched'", ps -> ps.setString(1, id));
            }
            return total;
        });
    }

    public List<QueueMessage> listByQueue(String queueKey) {
        return database.withConnection(conn -> query(conn,
                "SELECT " + MESSAGE_COLUMNS + " FROM queue_messages WHERE queue_key = ? ORDER BY arrived_at, rowid",
                ps -> ps.setString(1, queueKey), QueueRepository::mapMessage));
    }

    public List<QueueMessage> listByWorkItem(String workItemId) {
        return database.withConnection(conn -> query(conn,
                "SELECT " + MESSAGE_COLUMNS + " FROM queue_messages WHERE work_item_id = ? ORDER BY arrived_at, rowid",
                ps -> ps.setString(1, workItemId), QueueRepository::mapMessage));
    }

    private static QueueLaneRecord mapLane(ResultSet rs) throws SQLException {
        return QueueLaneRecord.builder()
                .queueKey(rs.getString("queue_key"))
                .sessionKey(rs.getString("session_key"))
                .agentId(rs.getString("agent_id"))
                .pluginInstanceId(rs.getString("plugin_instance_id"))
                .mode(QueueMode.parse(rs.getString("mode")))
                .debounceMs(rs.getLong("debounce_ms"))
                .maxQueued(rs.getInt("max_queued"))
                .build();
    }

    private static QueueMessage mapMessage(ResultSet rs) throws SQLException {
        return QueueMessage.builder()
                .id(rs.getString("id"))
                .queueKey(rs.getString("queue_key"))
                .workItemId(rs.getString("work_item_id"))
                .pluginInstanceId(rs.getString("plugin_instance_id"))
                .responseContext(rs.getString("response_context"))
                .text(rs.getString("text"))
                .senderName(rs.getString("sender_name"))
                .arrivedAt(rs.getLong("arrived_at"))
                .status(QueueMessageStatus.fromDb(rs.getString("status")))
                .dispatchId(rs.getString("dispatch_id"))
                .dropReason(rs.getString("drop_reason"))
                .build();
    }
}
