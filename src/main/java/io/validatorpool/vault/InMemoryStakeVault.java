package io.validatorpool.vault;

import io.validatorpool.error.ValidatorPoolException;
import io.validatorpool.model.Address;

import java.util.HashMap;
import java.util.Map;

public final class InMemoryStakeVault implements StakeVault {
    private final Map<Address, Long> holdings = new HashMap<>();

    public synchronized void fund(Address holder, long amount) {
        if (amount <= 0L) {
            throw new IllegalArgumentException("amount must be positive");
        }
        holdings.merge(holder, amount, Math::addExact);
    }

    public synchronized long holdingsOf(Address holder) {
        return holdings.getOrDefault(holder, 0L);
    }

    @Override
    public synchronized void pull(Address from, long amount) {
        long held = holdingsOf(from);
        if (amount > held) {
            throw ValidatorPoolException.insufficientFunds(from + " holds " + held + " outside the pool, needs " + amount);
        }
        holdings.put(from, held - amount);
    }

    @Override
    public synchronized void push(Address to, long amount) {
        holdings.merge(to, amount, Math::addExact);
    }
}
