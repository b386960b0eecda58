package io.validatorpool.rotation;

import io.validatorpool.model.Address;
import io.validatorpool.model.Assignment;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class RotationSchedulerTest {
    private static final Address A = Address.of("0x" + "0".repeat(39) + "a");
    private static final Address B = Address.of("0x" + "0".repeat(39) + "b");
    private static final Address C = Address.of("0x" + "0".repeat(39) + "c");

    private final RotationScheduler scheduler = new RotationScheduler(30L);

    @Test
    void cursorPicksValidatorModuloSetSize() {
        List<Address> set = List.of(A, B, C);
        Assertions.assertEquals(Assignment.assigned(A), scheduler.select(1_200L, 1_200L, set, 0L));
        Assertions.assertEquals(Assignment.assigned(B), scheduler.select(1_200L, 1_200L, set, 1L));
        Assertions.assertEquals(Assignment.assigned(C), scheduler.select(1_200L, 1_200L, set, 2L));
        Assertions.assertEquals(Assignment.assigned(A), scheduler.select(1_200L, 1_200L, set, 3L));
        Assertions.assertEquals(Assignment.assigned(B), scheduler.select(1_200L, 1_200L, List.of(A, B), 7L));
    }

    @Test
    void turnHoldsForOneRoundPastDeadline() {
        List<Address> set = List.of(A, B);
        Assertions.assertEquals(Assignment.assigned(A), scheduler.select(1_000L, 1_200L, set, 0L));
        Assertions.assertEquals(Assignment.assigned(A), scheduler.select(1_230L, 1_200L, set, 0L));
        Assertions.assertTrue(scheduler.select(1_231L, 1_200L, set, 0L).isPublicRound());
        Assertions.assertFalse(scheduler.publicRoundOpen(1_230L, 1_200L));
        Assertions.assertTrue(scheduler.publicRoundOpen(1_231L, 1_200L));
    }

    @Test
    void emptySetIsAlwaysPublicRound() {
        Assignment assignment = scheduler.select(0L, 1_200L, List.of(), 0L);
        Assertions.assertTrue(assignment.isPublicRound());
        Assertions.assertTrue(assignment.permits(A));
        Assertions.assertEquals(Address.maxValue(), assignment.toAddress(Address.maxValue()));
    }

    @Test
    void assignedTurnPermitsOnlyThatValidator() {
        Assignment assignment = Assignment.assigned(A);
        Assertions.assertTrue(assignment.permits(A));
        Assertions.assertFalse(assignment.permits(B));
        Assertions.assertEquals(A, assignment.toAddress(Address.maxValue()));
    }

    @Test
    void roundDurationMustBePositive() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RotationScheduler(0L));
    }
}
