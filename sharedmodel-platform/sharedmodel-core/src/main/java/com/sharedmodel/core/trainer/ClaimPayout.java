package com.sharedmodel.core.trainer;

import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.domain.ContributionKey;

import java.math.BigInteger;

/**
 * Outcome of a refund or report claim.
 */
public record ClaimPayout(ContributionKey key, Address recipient, BigInteger amount, String transferId) {}
