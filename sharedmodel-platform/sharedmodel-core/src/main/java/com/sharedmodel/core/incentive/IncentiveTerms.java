package com.sharedmodel.core.incentive;

import com.sharedmodel.core.math.UintMath;

import java.math.BigInteger;

/**
 * Pricing weight and claim wait periods, in seconds.
 * The wait periods must satisfy {@code refund <= ownerClaim <= anyAddressClaim}.
 */
public record IncentiveTerms(
        BigInteger costWeight,
        long refundWaitTime,
        long ownerClaimWaitTime,
        long anyAddressClaimWaitTime
) {
    public IncentiveTerms {
        UintMath.requireUint(costWeight);
        if (refundWaitTime < 0) {
            throw new IllegalArgumentException("Refund wait time must not be negative");
        }
        if (refundWaitTime > ownerClaimWaitTime) {
            throw new IllegalArgumentException(
                    "Owner claim wait time must be at least the refund wait time");
        }
        if (ownerClaimWaitTime > anyAddressClaimWaitTime) {
            throw new IllegalArgumentException(
                    "Any-address claim wait time must be at least the owner claim wait time");
        }
    }
}
