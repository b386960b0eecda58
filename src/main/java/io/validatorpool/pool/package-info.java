/**
 * Pool orchestration package.
 *
 * <p>{@link io.validatorpool.pool.ValidatorPool} wires the ledger, rotation scheduler, bond registry,
 * penalty calculator and reward outbox into single-transaction operations, and appends committed
 * events to the pool event log.
 */
package io.validatorpool.pool;
