package io.validatorpool.ledger;

import io.validatorpool.error.ValidatorPoolException;
import io.validatorpool.model.Address;
import io.validatorpool.storage.PoolStateKeys;
import io.validatorpool.storage.PoolStateTable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Free (unbonded) balances and the ordered validator set derived from them.
 *
 * <p>Every mutation keeps {@code isValidator(a) == balanceOf(a) >= minBondAmount}. The set is stored with an
 * explicit position column; removal moves the last member into the vacated slot so positions stay dense.
 * All methods run on the caller's connection and never commit.
 */
public final class BalanceLedger {
    private final long minBondAmount;
    private final RemovalListener removalListener;

    public BalanceLedger(long minBondAmount, RemovalListener removalListener) {
        this.minBondAmount = minBondAmount;
        this.removalListener = removalListener;
    }

    public long minBondAmount() {
        return minBondAmount;
    }

    public long balanceOf(Connection c, Address address) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT amount FROM balances WHERE address=?")) {
            ps.setString(1, address.value());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    public MembershipChange credit(Connection c, Address address, long amount, long now) throws SQLException {
        if (amount <= 0L) {
            throw ValidatorPoolException.belowMinimum("credit amount must be positive: " + amount);
        }
        long current = balanceOf(c, address);
        long updated;
        try {
            updated = Math.addExact(current, amount);
        } catch (ArithmeticException e) {
            throw new IllegalStateException("balance overflow for " + address, e);
        }
        writeBalance(c, address, updated, now);
        return syncMembership(c, address, updated, now);
    }

    public MembershipChange debit(Connection c, Address address, long amount, long now) throws SQLException {
        if (amount <= 0L) {
            throw ValidatorPoolException.belowMinimum("debit amount must be positive: " + amount);
        }
        long current = balanceOf(c, address);
        if (amount > current) {
            throw ValidatorPoolException.insufficientFunds(
                    address + " holds " + current + ", needs " + amount);
        }
        long updated = current - amount;
        writeBalance(c, address, updated, now);
        return syncMembership(c, address, updated, now);
    }

    public boolean isValidator(Connection c, Address address) throws SQLException {
        return positionOf(c, address) >= 0;
    }

    public long validatorCount(Connection c) throws SQLException {
        return PoolStateTable.read(c, PoolStateKeys.VALIDATOR_COUNT);
    }

    public List<Address> validators(Connection c) throws SQLException {
        List<Address> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT address FROM validators ORDER BY position ASC");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(Address.of(rs.getString(1)));
            }
        }
        return out;
    }

    public long totalBalance(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT COALESCE(SUM(amount),0) FROM balances");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private void writeBalance(Connection c, Address address, long amount, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO balances(address,amount,updated_at) VALUES(?,?,?) "
                        + "ON CONFLICT(address) DO UPDATE SET amount=excluded.amount,updated_at=excluded.updated_at")) {
            ps.setString(1, address.value());
            ps.setLong(2, amount);
            ps.setLong(3, now);
            ps.executeUpdate();
        }
    }

    private MembershipChange syncMembership(Connection c, Address address, long balance, long now) throws SQLException {
        boolean eligible = balance >= minBondAmount;
        int position = positionOf(c, address);
        if (eligible && position < 0) {
            append(c, address, now);
            return MembershipChange.JOINED;
        }
        if (!eligible && position >= 0) {
            removeAt(c, address, position, now);
            return MembershipChange.LEFT;
        }
        return MembershipChange.UNCHANGED;
    }

    private int positionOf(Connection c, Address address) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT position FROM validators WHERE address=?")) {
            ps.setString(1, address.value());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : -1;
            }
        }
    }

    private void append(Connection c, Address address, long now) throws SQLException {
        long count = validatorCount(c);
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO validators(address,position,joined_at) VALUES(?,?,?)")) {
            ps.setString(1, address.value());
            ps.setLong(2, count);
            ps.setLong(3, now);
            ps.executeUpdate();
        }
        PoolStateTable.add(c, PoolStateKeys.VALIDATOR_COUNT, 1L, now);
    }

    private void removeAt(Connection c, Address address, int position, long now) throws SQLException {
        long sizeBefore = validatorCount(c);
        long last = sizeBefore - 1L;
        try (PreparedStatement del = c.prepareStatement("DELETE FROM validators WHERE address=?")) {
            del.setString(1, address.value());
            del.executeUpdate();
        }
        if (position != last) {
            try (PreparedStatement move = c.prepareStatement("UPDATE validators SET position=? WHERE position=?")) {
                move.setLong(1, position);
                move.setLong(2, last);
                move.executeUpdate();
            }
        }
        PoolStateTable.add(c, PoolStateKeys.VALIDATOR_COUNT, -1L, now);
        removalListener.removed(c, position, sizeBefore, now);
    }

    /**
     * Notified inside the removing transaction, after the last member has been moved into the vacated slot.
     */
    @FunctionalInterface
    public interface RemovalListener {
        void removed(Connection c, long position, long sizeBefore, long now) throws SQLException;
    }
}
