package io.validatorpool.rotation;

import io.validatorpool.model.Address;
import io.validatorpool.model.Assignment;
import io.validatorpool.storage.PoolStateKeys;
import io.validatorpool.storage.PoolStateTable;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Round-robin turn selection over the ordered validator set.
 *
 * <p>The stored cursor is the position of the validator on turn; the turn is {@code validators[cursor mod size]}.
 * The cursor moves one slot when a checkpoint is accepted ({@link #advance}) and is rebased when a member leaves
 * ({@link #onRemoved}), so the member that was next stays next. A validator that lets a full round pass after the
 * expected deadline loses the turn to the public round until somebody submits.
 */
public final class RotationScheduler {
    private final long roundDuration;

    public RotationScheduler(long roundDuration) {
        if (roundDuration <= 0L) {
            throw new IllegalArgumentException("roundDuration must be positive");
        }
        this.roundDuration = roundDuration;
    }

    public long roundDuration() {
        return roundDuration;
    }

    public Assignment select(long now, long expectedDeadline, List<Address> validators, long cursor) {
        if (validators.isEmpty()) {
            return Assignment.publicRound();
        }
        if (publicRoundOpen(now, expectedDeadline)) {
            return Assignment.publicRound();
        }
        int index = (int) Math.floorMod(cursor, (long) validators.size());
        return Assignment.assigned(validators.get(index));
    }

    public boolean publicRoundOpen(long now, long expectedDeadline) {
        return now > expectedDeadline + roundDuration;
    }

    public long cursor(Connection c) throws SQLException {
        return PoolStateTable.read(c, PoolStateKeys.ROTATION_CURSOR);
    }

    /**
     * Hands the turn to the next slot of a set holding {@code size} members.
     */
    public long advance(Connection c, long size, long now) throws SQLException {
        long next = size <= 0L ? 0L : (Math.floorMod(cursor(c), size) + 1L) % size;
        PoolStateTable.write(c, PoolStateKeys.ROTATION_CURSOR, next, now);
        return next;
    }

    /**
     * Called after the member at {@code position} left a set of {@code sizeBefore} members and the last member
     * was moved into its slot.
     */
    public void onRemoved(Connection c, long position, long sizeBefore, long now) throws SQLException {
        long sizeAfter = sizeBefore - 1L;
        long last = sizeBefore - 1L;
        long onTurn = Math.floorMod(cursor(c), sizeBefore);
        long rebased;
        if (sizeAfter <= 0L) {
            rebased = 0L;
        } else if (onTurn == last) {
            // the member on turn was moved down, or was the one removed from the end
            rebased = position == last ? 0L : position;
        } else {
            rebased = onTurn;
        }
        PoolStateTable.write(c, PoolStateKeys.ROTATION_CURSOR, rebased, now);
    }
}
