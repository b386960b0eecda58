package io.validatorpool.vault;

import io.validatorpool.model.Address;

/**
 * Custody of the staked asset outside the pool's ledger. Deposits pull from a depositor's holdings,
 * withdrawals push back to them.
 */
public interface StakeVault {

    /**
     * Takes {@code amount} from {@code from}'s holdings.
     *
     * @throws io.validatorpool.error.ValidatorPoolException with {@code INSUFFICIENT_FUNDS} when the holder cannot
     *                                                     supply the amount
     */
    void pull(Address from, long amount);

    void push(Address to, long amount);
}
