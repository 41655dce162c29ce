package com.sharedmodel.core.event;

import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.domain.ContributionKey;

import java.math.BigInteger;

public record ReportRewarded<S>(
        ContributionKey key,
        S sample,
        long label,
        long submissionTime,
        Address originalAuthor,
        Address reporter,
        BigInteger amount
) implements ContributionEvent<S> {}
