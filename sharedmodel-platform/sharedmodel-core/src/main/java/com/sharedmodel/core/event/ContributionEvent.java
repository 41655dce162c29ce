package com.sharedmodel.core.event;

import com.sharedmodel.core.domain.ContributionKey;

import java.math.BigInteger;

/**
 * Domain event carrying a contribution's full identifying tuple. The ledger keeps only the
 * commitment, so these events are the only source from which a sample can be reconstructed.
 *
 * @param <S> sample type
 */
public interface ContributionEvent<S> {

    ContributionKey key();

    S sample();

    long label();

    long submissionTime();

    /**
     * Value moved by the event: the deposit for a submission, the payout for a claim.
     */
    BigInteger amount();
}
