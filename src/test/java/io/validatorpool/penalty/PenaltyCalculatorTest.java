package io.validatorpool.penalty;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class PenaltyCalculatorTest {
    private final PenaltyCalculator calculator = new PenaltyCalculator(10L, 20L);

    @Test
    void submissionsWithinGraceAreFree() {
        Assertions.assertEquals(0L, calculator.penalty(1_100L, 1_200L));
        Assertions.assertEquals(0L, calculator.penalty(1_200L, 1_200L));
        Assertions.assertEquals(0L, calculator.penalty(1_210L, 1_200L));
    }

    @Test
    void penaltyGrowsOneForOneAfterGrace() {
        Assertions.assertEquals(1L, calculator.penalty(1_211L, 1_200L));
        Assertions.assertEquals(15L, calculator.penalty(1_225L, 1_200L));
        Assertions.assertEquals(20L, calculator.penalty(1_230L, 1_200L));
    }

    @Test
    void oneFullRoundOfDelayIsFoldedBack() {
        Assertions.assertEquals(0L, calculator.penalty(1_240L, 1_200L));
        Assertions.assertEquals(15L, calculator.penalty(1_255L, 1_200L));
        Assertions.assertEquals(20L, calculator.penalty(1_260L, 1_200L));
    }

    @Test
    void penaltyNeverExceedsPenaltyPeriod() {
        Assertions.assertEquals(20L, calculator.penalty(1_300L, 1_200L));
        Assertions.assertEquals(20L, calculator.penalty(9_999L, 1_200L));
        Assertions.assertEquals(30L, calculator.roundDuration());
    }

    @Test
    void negativePeriodsAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PenaltyCalculator(-1L, 20L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PenaltyCalculator(10L, -1L));
    }
}
