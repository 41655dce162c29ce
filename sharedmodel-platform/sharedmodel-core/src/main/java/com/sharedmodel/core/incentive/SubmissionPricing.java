package com.sharedmodel.core.incentive;

import java.math.BigInteger;

/**
 * Prices one submission.
 *
 * @param <S> sample type
 */
@FunctionalInterface
public interface SubmissionPricing<S> {

    /**
     * @param costWeight     configured weight, never zero when called
     * @param elapsedSeconds seconds since the last charged submission
     * @param sample         the sample being priced, or {@code null} for a quote made before a
     *                       concrete submission exists
     * @param label          the label being priced; meaningless when {@code sample} is null
     */
    BigInteger cost(BigInteger costWeight, long elapsedSeconds, S sample, long label);
}
