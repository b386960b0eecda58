package io.validatorpool.observability;

import io.validatorpool.pool.ValidatorPool;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class PrometheusFormatterTest {

    @Test
    void rendersEveryGaugeWithOptionalNamespaceLabel() {
        ValidatorPool.PoolStats stats = new ValidatorPool.PoolStats(2L, 300L, 100L, 1L, 4L, 5L, 0L, 100L);

        String plain = PrometheusFormatter.format(stats);
        Assertions.assertTrue(plain.contains("# TYPE validatorpool_validators gauge\n"));
        Assertions.assertTrue(plain.contains("validatorpool_validators 2\n"));
        Assertions.assertTrue(plain.contains("validatorpool_free_balance_total 300\n"));
        Assertions.assertTrue(plain.contains("validatorpool_oldest_pending_checkpoint 4\n"));
        Assertions.assertTrue(plain.contains("validatorpool_rotation_cursor 5\n"));

        String labelled = PrometheusFormatter.format(stats, "team-a");
        Assertions.assertTrue(labelled.contains("validatorpool_bonded_total{namespace=\"team-a\"} 100\n"));
    }
}
