package com.sharedmodel.core.trainer;

import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.domain.ContributionKey;

import java.math.BigInteger;

/**
 * Outcome of a submission. {@code change} is the part of the payment above the cost,
 * returned to the submitter.
 */
public record SubmissionReceipt(
        ContributionKey key,
        long label,
        long addedTime,
        Address submitter,
        BigInteger cost,
        BigInteger change
) {}
