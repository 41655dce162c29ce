package com.sharedmodel.core.domain;

import java.math.BigInteger;
import java.util.Set;

/**
 * Point-in-time view of a contribution's escrow record.
 */
public record Contribution(
        ContributionKey key,
        long label,
        long submissionTime,
        Address submitter,
        BigInteger initialDeposit,
        BigInteger claimableAmount,
        long numClaims,
        Set<Address> claimedBy
) {
    public Contribution {
        claimedBy = Set.copyOf(claimedBy);
    }

    public boolean isLive() {
        return submitter != null && claimableAmount.signum() > 0;
    }

    public boolean hasClaimed(Address address) {
        return claimedBy.contains(address);
    }
}
