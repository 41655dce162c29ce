package com.sharedmodel.core.incentive;

import com.sharedmodel.core.math.UintMath;

import java.math.BigInteger;

/**
 * {@code costWeight * 3600 / isqrt(elapsed)}, with the divisor pinned to 1 at zero elapsed time.
 * The price falls as the model sits idle and ignores the sample content.
 */
public class TimeDecayPricing<S> implements SubmissionPricing<S> {

    static final BigInteger SECONDS_PER_HOUR = BigInteger.valueOf(3600);

    @Override
    public BigInteger cost(BigInteger costWeight, long elapsedSeconds, S sample, long label) {
        if (elapsedSeconds < 0) {
            throw new IllegalArgumentException("Elapsed time must not be negative");
        }
        long divisor = elapsedSeconds == 0 ? 1 : UintMath.sqrt(elapsedSeconds);
        return UintMath.div(UintMath.mul(costWeight, SECONDS_PER_HOUR), BigInteger.valueOf(divisor));
    }
}
