package io.validatorpool.bond;

import io.validatorpool.error.ErrorKind;
import io.validatorpool.error.ValidatorPoolException;
import io.validatorpool.model.Address;
import io.validatorpool.model.Bond;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bond rows keyed by checkpoint index. Pending bonds form a FIFO ordered by index; only the oldest one is
 * ever released. Runs on the caller's connection.
 */
public final class BondRegistry {

    public void insert(Connection c, Bond bond, long now) throws SQLException {
        if (find(c, bond.checkpointIndex()).isPresent()) {
            throw new ValidatorPoolException(ErrorKind.BOND_ALREADY_EXISTS,
                    "bond already exists for checkpoint " + bond.checkpointIndex());
        }
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO bonds(checkpoint_index,amount,expires_at,submitter,created_at,updated_at) VALUES(?,?,?,?,?,?)")) {
            ps.setLong(1, bond.checkpointIndex());
            ps.setLong(2, bond.amount());
            ps.setLong(3, bond.expiresAt());
            ps.setString(4, bond.submitter().value());
            ps.setLong(5, now);
            ps.setLong(6, now);
            ps.executeUpdate();
        }
    }

    public Optional<Bond> find(Connection c, long checkpointIndex) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT checkpoint_index,amount,expires_at,submitter FROM bonds WHERE checkpoint_index=?")) {
            ps.setLong(1, checkpointIndex);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readBond(rs)) : Optional.empty();
            }
        }
    }

    public Bond require(Connection c, long checkpointIndex) throws SQLException {
        return find(c, checkpointIndex).orElseThrow(() -> ValidatorPoolException.noSuchBond(checkpointIndex));
    }

    public Optional<Bond> oldest(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT checkpoint_index,amount,expires_at,submitter FROM bonds ORDER BY checkpoint_index ASC LIMIT 1");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(readBond(rs)) : Optional.empty();
        }
    }

    public List<Bond> pending(Connection c, int limit) throws SQLException {
        List<Bond> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT checkpoint_index,amount,expires_at,submitter FROM bonds ORDER BY checkpoint_index ASC LIMIT ?")) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readBond(rs));
                }
            }
        }
        return out;
    }

    public Bond updateAmount(Connection c, Bond bond, long newAmount, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE bonds SET amount=?,updated_at=? WHERE checkpoint_index=?")) {
            ps.setLong(1, newAmount);
            ps.setLong(2, now);
            ps.setLong(3, bond.checkpointIndex());
            if (ps.executeUpdate() == 0) {
                throw ValidatorPoolException.noSuchBond(bond.checkpointIndex());
            }
        }
        return new Bond(bond.checkpointIndex(), newAmount, bond.expiresAt(), bond.submitter());
    }

    public void delete(Connection c, long checkpointIndex) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM bonds WHERE checkpoint_index=?")) {
            ps.setLong(1, checkpointIndex);
            if (ps.executeUpdate() == 0) {
                throw ValidatorPoolException.noSuchBond(checkpointIndex);
            }
        }
    }

    public BondTotals totals(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT COUNT(*),COALESCE(SUM(amount),0),MIN(checkpoint_index) FROM bonds");
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return new BondTotals(0, 0L, -1L);
            }
            long oldest = rs.getLong(3);
            if (rs.wasNull()) {
                oldest = -1L;
            }
            return new BondTotals(rs.getInt(1), rs.getLong(2), oldest);
        }
    }

    private static Bond readBond(ResultSet rs) throws SQLException {
        return new Bond(
                rs.getLong("checkpoint_index"),
                rs.getLong("amount"),
                rs.getLong("expires_at"),
                Address.of(rs.getString("submitter"))
        );
    }

    public record BondTotals(int pendingCount, long totalBonded, long oldestIndex) {
    }
}
