package com.sharedmodel.core.event;

import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.domain.ContributionKey;

import java.math.BigInteger;

public record ContributionAdded<S>(
        ContributionKey key,
        S sample,
        long label,
        long submissionTime,
        Address submitter,
        BigInteger cost
) implements ContributionEvent<S> {

    @Override
    public BigInteger amount() {
        return cost;
    }
}
