package com.sharedmodel.core.ledger;

import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.domain.Contribution;
import com.sharedmodel.core.domain.ContributionKey;

import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable escrow state behind a ledger key. Only touched while the key's lock is held.
 */
final class ContributionRecord {

    private final ContributionKey key;
    private final long label;
    private final long submissionTime;
    private final Address submitter;
    private final BigInteger initialDeposit;
    private final Set<Address> claimedBy = new LinkedHashSet<>();
    private BigInteger claimableAmount;
    private long numClaims;

    ContributionRecord(ContributionKey key, long label, long submissionTime,
                       Address submitter, BigInteger deposit) {
        this.key = key;
        this.label = label;
        this.submissionTime = submissionTime;
        this.submitter = submitter;
        this.initialDeposit = deposit;
        this.claimableAmount = deposit;
        this.numClaims = 0;
    }

    boolean isLive() {
        return submitter != null && claimableAmount.signum() > 0;
    }

    boolean matches(long label, long submissionTime, Address submitter) {
        return this.label == label
                && this.submissionTime == submissionTime
                && this.submitter.equals(submitter);
    }

    /**
     * @return true if the claimant had not claimed before
     */
    boolean markClaimed(Address claimant) {
        numClaims++;
        return claimedBy.add(claimant);
    }

    void setClaimableAmount(BigInteger amount) {
        this.claimableAmount = amount;
    }

    BigInteger getInitialDeposit() { return initialDeposit; }
    BigInteger getClaimableAmount() { return claimableAmount; }
    long getNumClaims() { return numClaims; }
    boolean hasClaimed(Address address) { return claimedBy.contains(address); }

    Contribution snapshot() {
        return new Contribution(key, label, submissionTime, submitter,
                initialDeposit, claimableAmount, numClaims, claimedBy);
    }
}
