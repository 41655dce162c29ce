package com.sharedmodel.core.trainer;

import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.math.UintMath;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Credits payouts to per-address balances held in memory.
 */
public class InMemoryValueTransfer implements ValueTransfer {

    private final Map<Address, BigInteger> balances = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String transfer(Address to, BigInteger amount) {
        Objects.requireNonNull(to, "Recipient cannot be null");
        UintMath.requireUint(amount);
        balances.merge(to, amount, UintMath::add);
        return "local-" + sequence.incrementAndGet();
    }

    public BigInteger balanceOf(Address address) {
        return balances.getOrDefault(address, BigInteger.ZERO);
    }

    public BigInteger totalPaid() {
        return balances.values().stream().reduce(BigInteger.ZERO, UintMath::add);
    }
}
