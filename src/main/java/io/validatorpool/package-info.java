/**
 * Validator pool source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.validatorpool.pool.ValidatorPool} orchestrates deposits, withdrawals, bonding and release.</li>
 *   <li>{@code io.validatorpool.ledger.BalanceLedger} owns balances and the ordered validator set.</li>
 *   <li>{@code io.validatorpool.bond.BondRegistry} is the FIFO queue of pending bonds.</li>
 *   <li>{@code io.validatorpool.oracle.InMemoryCheckpointOracle} accepts checkpoints and calls back into the pool.</li>
 * </ul>
 */
package io.validatorpool;
