package com.fleetgate.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Statement helpers shared by the repositories.
 */
abstract class JdbcRepository {

    interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    protected final Database database;

    protected JdbcRepository(Database database) {
        this.database = database;
    }

    protected static int update(Connection conn, String sql, Binder binder) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        }
    }

    protected static <T> List<T> query(Connection conn, String sql, Binder binder, RowMapper<T> mapper)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
                return rows;
            }
        }
    }

    protected static <T> Optional<T> queryOne(Connection conn, String sql, Binder binder, RowMapper<T> mapper)
            throws SQLException {
        List<T> rows = query(conn, sql, binder, mapper);
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    protected static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    protected static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    protected static long nowSeconds() {
        return Instant.now().getEpochSecond();
    }

    /** SQLite reports unique/primary key violations as SQLITE_CONSTRAINT (19). */
    protected static boolean isConstraintViolation(SQLException e) {
        return e.getErrorCode() == 19
                || (e.getMessage() != null && e.getMessage().contains("SQLITE_CONSTRAINT"));
    }
}
