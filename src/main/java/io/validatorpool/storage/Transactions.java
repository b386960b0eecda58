package io.validatorpool.storage;

import io.validatorpool.error.ValidatorPoolException;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs a unit of work in a single SQLite transaction. Any exception rolls every statement back;
 * {@link ValidatorPoolException} reaches the caller unchanged, storage faults are wrapped.
 */
public final class Transactions {
    private Transactions() {
    }

    @FunctionalInterface
    public interface Work<T> {
        T apply(Connection c) throws SQLException;
    }

    public static <T> T inTransaction(Database database, String action, Work<T> work) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            T out;
            try {
                out = work.apply(c);
                c.commit();
            } catch (Exception e) {
                rollback(c, e);
                throw e;
            }
            c.setAutoCommit(true);
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + action, e);
        }
    }

    private static void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    public static <T> T read(Database database, String action, Work<T> work) {
        try (Connection c = database.openConnection()) {
            return work.apply(c);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + action, e);
        }
    }
}
