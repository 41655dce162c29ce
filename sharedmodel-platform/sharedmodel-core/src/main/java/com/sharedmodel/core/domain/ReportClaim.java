package com.sharedmodel.core.domain;

import java.math.BigInteger;

/**
 * Values observed by a report claim just before it marked the reporter.
 * The claimable amount is left for a separate debit.
 */
public record ReportClaim(
        BigInteger initialDeposit,
        BigInteger claimableAmount,
        boolean alreadyClaimed,
        long numClaims,
        ContributionKey key
) {}
