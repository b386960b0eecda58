package io.validatorpool.oracle;

import io.validatorpool.config.PoolParameters;
import io.validatorpool.config.ValidatorPoolConfig;
import io.validatorpool.error.ErrorKind;
import io.validatorpool.error.ValidatorPoolException;
import io.validatorpool.model.Address;
import io.validatorpool.model.Checkpoint;
import io.validatorpool.pool.ValidatorPool;
import io.validatorpool.reward.FileOutboxBridge;
import io.validatorpool.vault.InMemoryStakeVault;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class InMemoryCheckpointOracleTest {
    private static final Address STORAGE = Address.of("0x00000000000000000000000000000000000000a1");
    private static final Address DISPUTE = Address.of("0x00000000000000000000000000000000000000d1");
    private static final Address VAULT = Address.of("0x00000000000000000000000000000000000000ee");
    private static final Address V = Address.of("0x0000000000000000000000000000000000000001");
    private static final Address W = Address.of("0x0000000000000000000000000000000000000002");

    @Test
    void scheduleDerivesBlocksAndDeadlines() {
        SubmissionSchedule schedule = new SubmissionSchedule(10L, 1_000L, 2L, 100L);
        Assertions.assertEquals(110L, schedule.blockNumberFor(0L));
        Assertions.assertEquals(310L, schedule.blockNumberFor(2L));
        Assertions.assertEquals(1_200L, schedule.deadlineFor(110L));
        Assertions.assertEquals(200L, schedule.intervalSeconds());
        Assertions.assertThrows(IllegalArgumentException.class, () -> schedule.deadlineFor(9L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new SubmissionSchedule(0L, 0L, 0L, 100L));
    }

    @Test
    void acceptsOnlyTheNextBlockFromTheValidatorOnTurn() throws Exception {
        Path root = Files.createTempDirectory("validatorpool-test-oracle-submit-");
        try {
            InMemoryCheckpointOracle oracle = new InMemoryCheckpointOracle(new SubmissionSchedule(0L, 1_000L, 2L, 100L), STORAGE);
            Assertions.assertThrows(IllegalStateException.class,
                    () -> oracle.submitCheckpoint(V, 100L, "0xroot", 1_200L));

            ValidatorPoolConfig config = ValidatorPoolConfig.fromRoot(root.toString());
            InMemoryStakeVault vault = new InMemoryStakeVault();
            ValidatorPool pool = new ValidatorPool(config,
                    new PoolParameters(100L, 10L, 20L, 50L, Address.maxValue(), STORAGE, DISPUTE, VAULT, 100_000L),
                    oracle, vault, new FileOutboxBridge(config.bridgeOutboxRoot()));
            pool.init();
            oracle.connect(pool);
            vault.fund(V, 100L);
            vault.fund(W, 100L);
            pool.deposit(V, 100L, 1_000L);
            pool.deposit(W, 100L, 1_000L);

            Assertions.assertEquals(0L, oracle.nextExpectedIndex());
            Assertions.assertEquals(-1L, oracle.latestAcceptedIndex());
            Assertions.assertEquals(100L, oracle.nextExpectedBlockNumber());

            ValidatorPoolException wrongBlock = Assertions.assertThrows(ValidatorPoolException.class,
                    () -> oracle.submitCheckpoint(V, 200L, "0xroot", 1_400L));
            Assertions.assertEquals(ErrorKind.INVALID_CHECKPOINT, wrongBlock.kind());

            ValidatorPoolException premature = Assertions.assertThrows(ValidatorPoolException.class,
                    () -> oracle.submitCheckpoint(V, 100L, "0xroot", 1_199L));
            Assertions.assertEquals(ErrorKind.INVALID_CHECKPOINT, premature.kind());

            ValidatorPoolException offTurn = Assertions.assertThrows(ValidatorPoolException.class,
                    () -> oracle.submitCheckpoint(W, 100L, "0xroot", 1_200L));
            Assertions.assertEquals(ErrorKind.UNAUTHORIZED, offTurn.kind());

            Checkpoint accepted = oracle.submitCheckpoint(V, 100L, "0xroot", 1_205L);
            Assertions.assertEquals(new Checkpoint(0L, V, 100L, "0xroot", 1_205L), accepted);
            Assertions.assertEquals(0L, oracle.latestAcceptedIndex());
            Assertions.assertEquals(200L, oracle.nextExpectedBlockNumber());
            Assertions.assertEquals(accepted, oracle.getCheckpoint(0L).orElseThrow());
            Assertions.assertTrue(oracle.getCheckpoint(1L).isEmpty());
            Assertions.assertEquals(1_255L, pool.getBond(0L).expiresAt());
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
