package io.validatorpool.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Versioned scalar counters kept alongside the ledger, written inside the caller's transaction.
 */
public final class PoolStateTable {
    private PoolStateTable() {
    }

    public static long read(Connection c, String key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT state_value FROM pool_state WHERE state_key=?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalStateException("pool_state missing key: " + key);
                }
                return rs.getLong(1);
            }
        }
    }

    public static long add(Connection c, String key, long delta, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE pool_state SET state_value=state_value+?,version=version+1,updated_at=? WHERE state_key=?")) {
            ps.setLong(1, delta);
            ps.setLong(2, now);
            ps.setString(3, key);
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("pool_state missing key: " + key);
            }
        }
        return read(c, key);
    }

    public static void write(Connection c, String key, long value, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE pool_state SET state_value=?,version=version+1,updated_at=? WHERE state_key=?")) {
            ps.setLong(1, value);
            ps.setLong(2, now);
            ps.setString(3, key);
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("pool_state missing key: " + key);
            }
        }
    }
}
