package io.validatorpool.model;

/**
 * A checkpoint as recorded by checkpoint storage: who submitted it, the L2 block it commits to and the
 * L1 timestamp (epoch seconds) at which it was accepted.
 */
public record Checkpoint(
        long index,
        Address submitter,
        long l2BlockNumber,
        String outputRoot,
        long timestamp
) {
}
