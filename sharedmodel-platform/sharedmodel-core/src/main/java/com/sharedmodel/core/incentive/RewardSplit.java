package com.sharedmodel.core.incentive;

import java.math.BigInteger;

/**
 * Share of a bad contribution's deposit owed to a merit reporter, before clamping.
 */
@FunctionalInterface
public interface RewardSplit {

    BigInteger reward(BigInteger initialDeposit, long reporterNumValid, long totalGoodDataCount);
}
