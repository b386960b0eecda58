package io.validatorpool.storage;

import io.validatorpool.config.ValidatorPoolConfig;
import io.validatorpool.error.ErrorKind;
import io.validatorpool.error.ValidatorPoolException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

final class DatabaseMigrationTest {

    @Test
    void initIsIdempotentAndRecordsMigrationsOnce() throws Exception {
        Path root = Files.createTempDirectory("validatorpool-test-migrations-");
        try {
            ValidatorPoolConfig config = ValidatorPoolConfig.fromRoot(root.toString());
            Database database = new Database(config);
            database.init();
            List<Database.SchemaMigrationRow> first = database.listSchemaMigrations(10);
            database.init();
            List<Database.SchemaMigrationRow> second = database.listSchemaMigrations(10);

            Assertions.assertEquals(2, first.size());
            Assertions.assertEquals(first, second);
            Assertions.assertTrue(second.stream().allMatch(Database.SchemaMigrationRow::success));
            Assertions.assertTrue(second.stream().anyMatch(r -> r.version().equals("20261018_001_bond_queue_indexes")));
            Assertions.assertTrue(Files.exists(config.dbFile()));

            long cursor = Transactions.read(database, "read cursor",
                    c -> PoolStateTable.read(c, PoolStateKeys.ROTATION_CURSOR));
            Assertions.assertEquals(0L, cursor);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedWorkLeavesCountersUntouched() throws Exception {
        Path root = Files.createTempDirectory("validatorpool-test-transactions-");
        try {
            Database database = new Database(ValidatorPoolConfig.fromRoot(root.toString()));
            database.init();
            Assertions.assertThrows(IllegalStateException.class, () -> Transactions.inTransaction(database, "bump", c -> {
                PoolStateTable.add(c, PoolStateKeys.ROTATION_CURSOR, 5L, 1L);
                throw new IllegalStateException("abort");
            }));
            long afterAbort = Transactions.read(database, "read cursor",
                    c -> PoolStateTable.read(c, PoolStateKeys.ROTATION_CURSOR));
            Assertions.assertEquals(0L, afterAbort);

            long committed = Transactions.inTransaction(database, "bump",
                    c -> PoolStateTable.add(c, PoolStateKeys.ROTATION_CURSOR, 2L, 1L));
            Assertions.assertEquals(2L, committed);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rollbackFailureIsAttachedToTheOriginalError() throws Exception {
        Path root = Files.createTempDirectory("validatorpool-test-rollback-failure-");
        try {
            Database database = new Database(ValidatorPoolConfig.fromRoot(root.toString()));
            database.init();
            ValidatorPoolException failure = Assertions.assertThrows(ValidatorPoolException.class,
                    () -> Transactions.inTransaction(database, "bump", c -> {
                        PoolStateTable.add(c, PoolStateKeys.ROTATION_CURSOR, 1L, 1L);
                        c.close();
                        throw ValidatorPoolException.noSuchBond(7L);
                    }));
            Assertions.assertEquals(ErrorKind.NO_SUCH_BOND, failure.kind());
            Assertions.assertTrue(Arrays.stream(failure.getSuppressed()).anyMatch(s -> s instanceof SQLException));

            long cursor = Transactions.read(database, "read cursor",
                    c -> PoolStateTable.read(c, PoolStateKeys.ROTATION_CURSOR));
            Assertions.assertEquals(0L, cursor);
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
