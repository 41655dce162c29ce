package com.sharedmodel.core.incentive;

import com.sharedmodel.core.math.UintMath;

import java.math.BigInteger;

/**
 * {@code floor(initialDeposit * reporterNumValid / totalGoodDataCount)}.
 */
public class MeritWeightedSplit implements RewardSplit {

    @Override
    public BigInteger reward(BigInteger initialDeposit, long reporterNumValid, long totalGoodDataCount) {
        return UintMath.div(
                UintMath.mul(initialDeposit, BigInteger.valueOf(reporterNumValid)),
                BigInteger.valueOf(totalGoodDataCount));
    }
}
