package com.sharedmodel.core.domain;

import java.math.BigInteger;

/**
 * Values observed by a refund claim just before it drained the record.
 */
public record RefundClaim(BigInteger claimableAmount, boolean alreadyClaimed, long numClaims) {}
