package com.fleetgate.store;

import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Properties;

/**
 * SQLite-backed relational store shared by the router, the queue manager and the
 * scheduler ticker.
 * <p>
 * Connections run in WAL mode with a busy timeout, and transactions start
 * {@code IMMEDIATE} so concurrent writers queue on the database lock instead of failing
 * on lock upgrade. Cross-process exclusivity relies on conditional updates, not on this
 * class.
 */
@Slf4j
public class Database {

    /** Work done with an open connection. */
    @FunctionalInterface
    public interface SqlFunction<T> {
        T apply(Connection conn) throws SQLException;
    }

    private static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS plugins ("
                    + "id TEXT PRIMARY KEY, enabled INTEGER NOT NULL DEFAULT 1, updated_at INTEGER NOT NULL)",
            "CREATE TABLE IF NOT EXISTS plugin_instances ("
                    + "id TEXT PRIMARY KEY, plugin_id TEXT NOT NULL, type TEXT NOT NULL, name TEXT,"
                    + " enabled INTEGER NOT NULL DEFAULT 1, config TEXT, created_at INTEGER NOT NULL)",
            "CREATE TABLE IF NOT EXISTS plugin_events ("
                    + "id TEXT PRIMARY KEY, plugin_id TEXT NOT NULL, plugin_instance_id TEXT, kind TEXT NOT NULL,"
                    + " status TEXT NOT NULL, work_item_id TEXT, detail TEXT, created_at INTEGER NOT NULL)",
            "CREATE TABLE IF NOT EXISTS agents ("
                    + "id TEXT PRIMARY KEY, handle TEXT NOT NULL UNIQUE, name TEXT,"
                    + " status TEXT NOT NULL DEFAULT 'idle', config TEXT, created_at INTEGER NOT NULL)",
            "CREATE TABLE IF NOT EXISTS agent_plugin_instances ("
                    + "agent_id TEXT NOT NULL, plugin_instance_id TEXT NOT NULL, position INTEGER NOT NULL DEFAULT 0,"
                    + " PRIMARY KEY (agent_id, plugin_instance_id))",
            "CREATE TABLE IF NOT EXISTS work_items ("
                    + "id TEXT PRIMARY KEY, source TEXT NOT NULL, source_ref TEXT NOT NULL, plugin_instance_id TEXT,"
                    + " session_key TEXT NOT NULL, status TEXT NOT NULL, title TEXT NOT NULL, payload TEXT,"
                    + " created_at INTEGER NOT NULL, updated_at INTEGER NOT NULL, UNIQUE (source, source_ref))",
            "CREATE TABLE IF NOT EXISTS idempotency_keys ("
                    + "key TEXT PRIMARY KEY, work_item_id TEXT NOT NULL, created_at INTEGER NOT NULL)",
            "CREATE TABLE IF NOT EXISTS work_item_events ("
                    + "id TEXT PRIMARY KEY, work_item_id TEXT NOT NULL, kind TEXT NOT NULL, envelope TEXT,"
                    + " created_at INTEGER NOT NULL)",
            "CREATE TABLE IF NOT EXISTS queue_lanes ("
                    + "queue_key TEXT PRIMARY KEY, session_key TEXT NOT NULL, agent_id TEXT NOT NULL,"
                    + " plugin_instance_id TEXT, mode TEXT NOT NULL, debounce_ms INTEGER NOT NULL,"
                    + " max_queued INTEGER NOT NULL, created_at INTEGER NOT NULL, updated_at INTEGER NOT NULL)",
            "CREATE TABLE IF NOT EXISTS queue_messages ("
                    + "id TEXT PRIMARY KEY, queue_key TEXT NOT NULL, work_item_id TEXT NOT NULL,"
                    + " plugin_instance_id TEXT, response_context TEXT, text TEXT, sender_name TEXT,"
                    + " arrived_at INTEGER NOT NULL, status TEXT NOT NULL, dispatch_id TEXT, drop_reason TEXT)",
            "CREATE INDEX IF NOT EXISTS idx_queue_messages_lane ON queue_messages (queue_key, status, arrived_at)",
            "CREATE TABLE IF NOT EXISTS scheduled_items ("
                    + "id TEXT PRIMARY KEY, agent_id TEXT NOT NULL, session_key TEXT NOT NULL, type TEXT NOT NULL,"
                    + " payload TEXT, run_at INTEGER NOT NULL, recurrence TEXT, status TEXT NOT NULL,"
                    + " source_ref TEXT, plugin_instance_id TEXT, response_context TEXT, routine_id TEXT,"
                    + " routine_run_id TEXT, created_at INTEGER NOT NULL, fired_at INTEGER, cancelled_at INTEGER)",
            "CREATE INDEX IF NOT EXISTS idx_scheduled_items_due ON scheduled_items (status, run_at)",
            "CREATE TABLE IF NOT EXISTS routines ("
                    + "id TEXT PRIMARY KEY, name TEXT NOT NULL, agent_id TEXT NOT NULL, trigger_kind TEXT NOT NULL,"
                    + " enabled INTEGER NOT NULL DEFAULT 1, next_run_at INTEGER, last_fired_at INTEGER,"
                    + " last_status TEXT, updated_at INTEGER NOT NULL)",
            "CREATE TABLE IF NOT EXISTS routine_runs ("
                    + "id TEXT PRIMARY KEY, routine_id TEXT NOT NULL, scheduled_item_id TEXT, work_item_id TEXT,"
                    + " status TEXT NOT NULL, created_at INTEGER NOT NULL, updated_at INTEGER NOT NULL)");

    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(Path dbFile, int busyTimeoutMs) {
        this.jdbcUrl = "jdbc:sqlite:" + dbFile.toString();
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(busyTimeoutMs);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = config.toProperties();
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to create database directory for " + dbFile, e);
        }
    }

    /**
     * Create tables and indexes that do not exist yet.
     */
    public void init() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                st.execute(ddl);
            }
            log.info("Store initialized: {}", jdbcUrl);
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize schema", e);
        }
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    /**
     * Run {@code fn} on an auto-commit connection.
     */
    public <T> T withConnection(SqlFunction<T> fn) {
        try (Connection conn = openConnection()) {
            return fn.apply(conn);
        } catch (SQLException e) {
            throw new StoreException("Database operation failed: " + e.getMessage(), e);
        }
    }

    /**
     * Run {@code fn} inside one transaction. Any exception rolls back every write made
     * through the supplied connection; runtime exceptions propagate unchanged, SQL
     * exceptions are wrapped in {@link StoreException}.
     */
    public <T> T transaction(SqlFunction<T> fn) {
        try (Connection conn = openConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = fn.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Transaction failed: " + e.getMessage(), e);
        }
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }
}
