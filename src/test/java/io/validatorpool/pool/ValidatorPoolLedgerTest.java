package io.validatorpool.pool;

import io.validatorpool.error.ErrorKind;
import io.validatorpool.error.ValidatorPoolException;
import io.validatorpool.ledger.MembershipChange;
import io.validatorpool.model.Address;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.validatorpool.pool.PoolFixture.address;

final class ValidatorPoolLedgerTest {

    @Test
    void depositJoinsValidatorSetOnlyWhenThresholdIsCrossed() throws Exception {
        PoolFixture f = PoolFixture.open("validatorpool-test-ledger-threshold-");
        try {
            Address a = address(1);
            f.vault.fund(a, 500L);

            ValidatorPool.LedgerOutcome first = f.pool.deposit(a, 60L, 1_000L);
            Assertions.assertEquals(MembershipChange.UNCHANGED, first.change());
            Assertions.assertFalse(first.validator());
            Assertions.assertEquals(0L, first.validatorCount());

            ValidatorPool.LedgerOutcome second = f.pool.deposit(a, 40L, 1_001L);
            Assertions.assertEquals(MembershipChange.JOINED, second.change());
            Assertions.assertEquals(100L, second.balance());
            Assertions.assertEquals(1L, second.validatorCount());

            ValidatorPool.LedgerOutcome third = f.pool.deposit(a, 50L, 1_002L);
            Assertions.assertEquals(MembershipChange.UNCHANGED, third.change());
            Assertions.assertEquals(1L, third.validatorCount());
            Assertions.assertEquals(List.of(a), f.pool.validators());
            Assertions.assertEquals(350L, f.vault.holdingsOf(a));
        } finally {
            f.close();
        }
    }

    @Test
    void depositThenWithdrawRestoresBalanceAndMembership() throws Exception {
        PoolFixture f = PoolFixture.open("validatorpool-test-ledger-roundtrip-");
        try {
            Address a = address(1);
            Address b = address(2);
            f.fundAndDeposit(a, 120L, 1_000L);
            f.vault.fund(b, 100L);

            f.pool.deposit(a, 30L, 1_001L);
            f.pool.withdraw(a, 30L, 1_002L);
            Assertions.assertEquals(120L, f.pool.balanceOf(a));
            Assertions.assertTrue(f.pool.isValidator(a));

            f.pool.deposit(b, 100L, 1_003L);
            ValidatorPool.LedgerOutcome left = f.pool.withdraw(b, 100L, 1_004L);
            Assertions.assertEquals(MembershipChange.LEFT, left.change());
            Assertions.assertEquals(0L, f.pool.balanceOf(b));
            Assertions.assertFalse(f.pool.isValidator(b));
            Assertions.assertEquals(100L, f.vault.holdingsOf(b));
            Assertions.assertEquals(List.of(a), f.pool.validators());
            Assertions.assertEquals(1L, f.pool.validatorCount());
        } finally {
            f.close();
        }
    }

    @Test
    void overdraftsAreRejectedWithoutTouchingLedgerOrVault() throws Exception {
        PoolFixture f = PoolFixture.open("validatorpool-test-ledger-overdraft-");
        try {
            Address a = address(1);
            f.fundAndDeposit(a, 100L, 1_000L);

            ValidatorPoolException withdraw = Assertions.assertThrows(ValidatorPoolException.class,
                    () -> f.pool.withdraw(a, 101L, 1_001L));
            Assertions.assertEquals(ErrorKind.INSUFFICIENT_FUNDS, withdraw.kind());

            ValidatorPoolException deposit = Assertions.assertThrows(ValidatorPoolException.class,
                    () -> f.pool.deposit(a, 1L, 1_002L));
            Assertions.assertEquals(ErrorKind.INSUFFICIENT_FUNDS, deposit.kind());

            ValidatorPoolException zero = Assertions.assertThrows(ValidatorPoolException.class,
                    () -> f.pool.deposit(a, 0L, 1_003L));
            Assertions.assertEquals(ErrorKind.ZERO_OR_BELOW_MINIMUM, zero.kind());

            Assertions.assertEquals(100L, f.pool.balanceOf(a));
            Assertions.assertTrue(f.pool.isValidator(a));
            Assertions.assertEquals(0L, f.vault.holdingsOf(a));
        } finally {
            f.close();
        }
    }

    @Test
    void eligibilityTracksBalanceAfterEveryMutation() throws Exception {
        PoolFixture f = PoolFixture.open("validatorpool-test-ledger-eligibility-");
        try {
            List<Address> holders = List.of(address(1), address(2), address(3), address(4));
            for (Address holder : holders) {
                f.vault.fund(holder, 1_000L);
            }
            long[][] steps = {
                    {0, 150}, {1, 99}, {2, 100}, {1, 1}, {0, -60}, {3, 250}, {2, -1}, {3, -150}, {0, 10}
            };
            long now = 1_000L;
            for (long[] step : steps) {
                Address holder = holders.get((int) step[0]);
                if (step[1] > 0) {
                    f.pool.deposit(holder, step[1], now++);
                } else {
                    f.pool.withdraw(holder, -step[1], now++);
                }
                long members = 0L;
                for (Address each : holders) {
                    boolean eligible = f.pool.balanceOf(each) >= 100L;
                    Assertions.assertEquals(eligible, f.pool.isValidator(each), "after step on " + holder);
                    members += eligible ? 1L : 0L;
                }
                Assertions.assertEquals(members, f.pool.validatorCount());
                Assertions.assertEquals(members, f.pool.validators().size());
            }
            Assertions.assertTrue(f.pool.eventLog().verify().valid());
        } finally {
            f.close();
        }
    }
}
