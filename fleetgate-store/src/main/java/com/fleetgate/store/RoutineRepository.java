package com.fleetgate.store;

import com.fleetgate.store.model.Routine;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;

/**
 * Routines and routine-run bookkeeping touched when a scheduled item fires.
 */
public class RoutineRepository extends JdbcRepository {

    private static final String COLUMNS = "id, name, agent_id, trigger_kind, enabled, next_run_at, last_fired_at,"
            + " last_status";

    public RoutineRepository(Database database) {
        super(database);
    }

    public Routine create(Routine routine) {
        if (routine.getId() == null) {
            routine.setId(UUID.randomUUID().toString());
        }
        database.withConnection(conn -> update(conn, "INSERT INTO routines(" + COLUMNS + ", updated_at)"
                + " VALUES(?,?,?,?,?,?,?,?,?)", ps -> {
            ps.setString(1, routine.getId());
            ps.setString(2, routine.getName());
            ps.setString(3, routine.getAgentId());
            ps.setString(4, routine.getTriggerKind());
            ps.setInt(5, routine.isEnabled() ? 1 : 0);
            setNullableLong(ps, 6, routine.getNextRunAt());
            setNullableLong(ps, 7, routine.getLastFiredAt());
            ps.setString(8, routine.getLastStatus());
            ps.setLong(9, nowSeconds());
        }));
        return routine;
    }

    public Optional<Routine> findById(String id) {
        return database.withConnection(conn -> findById(conn, id));
    }

    public Optional<Routine> findById(Connection conn, String id) throws SQLException {
        return queryOne(conn, "SELECT " + COLUMNS + " FROM routines WHERE id = ?",
                ps -> ps.setString(1, id), RoutineRepository::map);
    }

    /**
     * Record a fire on the routine; one-shot routines are disabled and unscheduled.
     */
    public void recordFired(Connection conn, String routineId, long firedAt, boolean disable) throws SQLException {
        if (disable) {
            update(conn, "UPDATE routines SET last_fired_at = ?, last_status = 'fired', enabled = 0,"
                    + " next_run_at = NULL, updated_at = ? WHERE id = ?", ps -> {
                ps.setLong(1, firedAt);
                ps.setLong(2, nowSeconds());
                ps.setString(3, routineId);
            });
        } else {
            update(conn, "UPDATE routines SET last_fired_at = ?, last_status = 'fired', updated_at = ? WHERE id = ?",
                    ps -> {
                        ps.setLong(1, firedAt);
                        ps.setLong(2, nowSeconds());
                        ps.setString(3, routineId);
                    });
        }
    }

    public String createRun(String routineId, String scheduledItemId) {
        String id = UUID.randomUUID().toString();
        long now = nowSeconds();
        database.withConnection(conn -> update(conn, "INSERT INTO routine_runs(id, routine_id, scheduled_item_id,"
                + " work_item_id, status, created_at, updated_at) VALUES(?,?,?,?,?,?,?)", ps -> {
            ps.setString(1, id);
            ps.setString(2, routineId);
            ps.setString(3, scheduledItemId);
            ps.setString(4, null);
            ps.setString(5, "scheduled");
            ps.setLong(6, now);
            ps.setLong(7, now);
        }));
        return id;
    }

    /**
     * Attach the created work item to a routine run.
     */
    public void linkRunToWorkItem(Connection conn, String runId, String workItemId) throws SQLException {
        update(conn, "UPDATE routine_runs SET work_item_id = ?, status = 'fired', updated_at = ? WHERE id = ?", ps -> {
            ps.setString(1, workItemId);
            ps.setLong(2, nowSeconds());
            ps.setString(3, runId);
        });
    }

    public Optional<String> findRunWorkItemId(String runId) {
        return database.withConnection(conn -> queryOne(conn,
                "SELECT work_item_id FROM routine_runs WHERE id = ?",
                ps -> ps.setString(1, runId), rs -> rs.getString("work_item_id")));
    }

    private static Routine map(ResultSet rs) throws SQLException {
        return Routine.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .agentId(rs.getString("agent_id"))
                .triggerKind(rs.getString("trigger_kind"))
                .enabled(rs.getInt("enabled") == 1)
                .nextRunAt(getNullableLong(rs, "next_run_at"))
                .lastFiredAt(getNullableLong(rs, "last_fired_at"))
                .lastStatus(rs.getString("last_status"))
                .build();
    }
}
