package com.sharedmodel.core.incentive;

import com.sharedmodel.core.access.OwnershipGate;
import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.error.EconomicException;
import com.sharedmodel.core.error.ErrorReason;
import com.sharedmodel.core.error.PermissionException;
import com.sharedmodel.core.error.TimingException;
import com.sharedmodel.core.math.UintMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Deposit-based incentive mechanism: prices submissions and decides refund and report claims.
 *
 * <p>The engine never reads a clock. Every time-dependent call carries the current time in
 * seconds. Pricing rejects a reading earlier than the last charged submission; adjudication
 * rejects one earlier than the contribution's submission time. All state is guarded by
 * the engine's monitor. Adjudication checks every precondition before touching any counter, so a
 * rejected call leaves no trace.
 *
 * <p>Report tiers, first match wins:
 * <ol>
 *   <li>owner sweep: the owner, once {@code ownerClaimWaitTime} has passed, takes the rest;</li>
 *   <li>open sweep: anyone, once {@code anyAddressClaimWaitTime} has passed, takes the rest;</li>
 *   <li>merit report: a reporter with validated contributions of their own, when the model
 *       disagrees with the label, takes a share weighted by their good-data count.</li>
 * </ol>
 *
 * @param <S> sample type handed to the pricing policy
 */
public class StakingIncentiveEngine<S> {

    private static final Logger log = LoggerFactory.getLogger(StakingIncentiveEngine.class);

    private final OwnershipGate orchestratorGate;
    private final IncentiveTerms terms;
    private final SubmissionPricing<S> pricing;
    private final RewardSplit rewardSplit;
    private final Map<Address, Long> numValidForAddress = new HashMap<>();

    private Address owner;
    private long lastUpdateTime;
    private long totalSubmitted;
    private long totalGoodDataCount;

    public StakingIncentiveEngine(OwnershipGate orchestratorGate, Address owner, IncentiveTerms terms,
                                  long startTime) {
        this(orchestratorGate, owner, terms, startTime, new TimeDecayPricing<>(), new MeritWeightedSplit());
    }

    public StakingIncentiveEngine(OwnershipGate orchestratorGate, Address owner, IncentiveTerms terms,
                                  long startTime, SubmissionPricing<S> pricing, RewardSplit rewardSplit) {
        this.orchestratorGate = Objects.requireNonNull(orchestratorGate, "Gate cannot be null");
        this.owner = Objects.requireNonNull(owner, "Owner cannot be null");
        this.terms = Objects.requireNonNull(terms, "Terms cannot be null");
        this.pricing = Objects.requireNonNull(pricing, "Pricing cannot be null");
        this.rewardSplit = Objects.requireNonNull(rewardSplit, "Reward split cannot be null");
        if (startTime < 0) {
            throw new IllegalArgumentException("Start time must not be negative");
        }
        this.lastUpdateTime = startTime;
    }

    // ==================== Pricing ====================

    public BigInteger quoteCost(long currentTime) {
        return quoteCost(null, 0L, currentTime);
    }

    /**
     * Cost of submitting {@code sample} with {@code label} at {@code currentTime}.
     */
    public synchronized BigInteger quoteCost(S sample, long label, long currentTime) {
        if (terms.costWeight().signum() == 0) {
            return BigInteger.ZERO;
        }
        verifyClock(currentTime);
        return pricing.cost(terms.costWeight(), currentTime - lastUpdateTime, sample, label);
    }

    public BigInteger chargeForSubmission(Address caller, BigInteger paidAmount, long currentTime) {
        return chargeForSubmission(caller, paidAmount, null, 0L, currentTime);
    }

    /**
     * Charges for one submission and restarts the pricing clock.
     *
     * @return the cost, which becomes the contribution's deposit
     */
    public synchronized BigInteger chargeForSubmission(Address caller, BigInteger paidAmount,
                                                       S sample, long label, long currentTime) {
        orchestratorGate.require(caller);
        UintMath.requireUint(paidAmount);
        verifyClock(currentTime);
        BigInteger cost = quoteCost(sample, label, currentTime);
        if (paidAmount.compareTo(cost) < 0) {
            throw new EconomicException(ErrorReason.INSUFFICIENT_PAYMENT,
                    "Paid " + paidAmount + " but the submission costs " + cost);
        }
        lastUpdateTime = currentTime;
        totalSubmitted++;
        return cost;
    }

    // ==================== Claims ====================

    /**
     * Decides a refund claim by the original submitter.
     *
     * @return the refund, always the whole claimable amount
     */
    public synchronized BigInteger adjudicateRefund(Address caller, Address claimant,
                                                    long submissionTime, long currentTime,
                                                    BigInteger claimableAmount, boolean alreadyClaimed,
                                                    long prediction, long label) {
        orchestratorGate.require(caller);
        Objects.requireNonNull(claimant, "Claimant cannot be null");
        UintMath.requireUint(claimableAmount);
        long elapsed = elapsedSince(submissionTime, currentTime);

        if (alreadyClaimed) {
            throw new EconomicException(ErrorReason.ALREADY_CLAIMED, "Deposit already claimed by " + claimant);
        }
        if (claimableAmount.signum() == 0) {
            throw new EconomicException(ErrorReason.NOTHING_TO_CLAIM, "There is no deposit left to refund");
        }
        if (elapsed < terms.refundWaitTime()) {
            throw new TimingException(ErrorReason.TOO_EARLY,
                    "Refund allowed after " + terms.refundWaitTime() + "s, only " + elapsed + "s passed");
        }
        if (prediction != label) {
            throw new EconomicException(ErrorReason.MODEL_DISAGREES,
                    "The model predicts " + prediction + " but the contribution is labeled " + label);
        }

        numValidForAddress.merge(claimant, 1L, Math::addExact);
        totalGoodDataCount++;
        log.debug("Refund of {} approved for {}", claimableAmount, claimant);
        return claimableAmount;
    }

    /**
     * Decides a report claim against someone else's contribution, or a sweep of an unclaimed one.
     *
     * @return the reward, never more than {@code claimableAmount}
     */
    public synchronized BigInteger adjudicateReport(Address caller, Address reporter,
                                                    long submissionTime, long currentTime,
                                                    Address originalAuthor, BigInteger initialDeposit,
                                                    BigInteger claimableAmount, boolean alreadyClaimedByReporter,
                                                    long prediction, long label) {
        orchestratorGate.require(caller);
        Objects.requireNonNull(reporter, "Reporter cannot be null");
        Objects.requireNonNull(originalAuthor, "Original author cannot be null");
        UintMath.requireUint(initialDeposit);
        UintMath.requireUint(claimableAmount);
        long elapsed = elapsedSince(submissionTime, currentTime);

        if (claimableAmount.signum() == 0) {
            throw new EconomicException(ErrorReason.NOTHING_TO_CLAIM, "There is no deposit left to claim");
        }

        BigInteger reward;
        if (elapsed >= terms.ownerClaimWaitTime() && reporter.equals(owner)) {
            reward = claimableAmount;
            log.debug("Owner sweep of {} by {}", reward, reporter);
        } else if (elapsed >= terms.anyAddressClaimWaitTime()) {
            reward = claimableAmount;
            log.debug("Open sweep of {} by {}", reward, reporter);
        } else {
            reward = meritReward(reporter, elapsed, originalAuthor, initialDeposit, claimableAmount,
                    alreadyClaimedByReporter, prediction, label);
        }
        return reward;
    }

    private BigInteger meritReward(Address reporter, long elapsed, Address originalAuthor,
                                   BigInteger initialDeposit, BigInteger claimableAmount,
                                   boolean alreadyClaimedByReporter, long prediction, long label) {
        if (reporter.equals(originalAuthor)) {
            throw new EconomicException(ErrorReason.SELF_REPORT, "Cannot report your own contribution");
        }
        if (alreadyClaimedByReporter) {
            throw new EconomicException(ErrorReason.ALREADY_CLAIMED,
                    "Contribution already reported by " + reporter);
        }
        if (elapsed < terms.refundWaitTime()) {
            throw new TimingException(ErrorReason.TOO_EARLY,
                    "Reports allowed after " + terms.refundWaitTime() + "s, only " + elapsed + "s passed");
        }
        if (prediction == label) {
            throw new EconomicException(ErrorReason.MODEL_AGREES,
                    "The model agrees with label " + label + "; nothing to report");
        }
        long reporterNumValid = numValidForAddress.getOrDefault(reporter, 0L);
        if (reporterNumValid == 0) {
            throw new EconomicException(ErrorReason.NO_STANDING,
                    reporter + " has no validated contributions of their own");
        }

        BigInteger reward = rewardSplit.reward(initialDeposit, reporterNumValid, totalGoodDataCount);
        // A zero share would leave the deposit stuck; a share above the balance cannot be paid.
        if (reward.signum() == 0 || reward.compareTo(claimableAmount) > 0) {
            reward = claimableAmount;
        }
        return reward;
    }

    // ==================== Ownership ====================

    public synchronized void transferOwnership(Address caller, Address newOwner) {
        Objects.requireNonNull(newOwner, "New owner cannot be null");
        if (!owner.equals(caller)) {
            throw new PermissionException(ErrorReason.UNAUTHORIZED, "Only the owner can transfer ownership");
        }
        log.info("Incentive engine ownership transferred from {} to {}", owner, newOwner);
        owner = newOwner;
    }

    // ==================== Views ====================

    public synchronized long getNumValid(Address address) {
        return numValidForAddress.getOrDefault(address, 0L);
    }

    public synchronized long getTotalSubmitted() { return totalSubmitted; }
    public synchronized long getTotalGoodDataCount() { return totalGoodDataCount; }
    public synchronized long getLastUpdateTime() { return lastUpdateTime; }
    public synchronized Address getOwner() { return owner; }
    public IncentiveTerms getTerms() { return terms; }
    public OwnershipGate getOrchestratorGate() { return orchestratorGate; }

    /**
     * Fails with {@code ClockRegression} if {@code currentTime} precedes the last charged submission.
     */
    public synchronized void verifyClock(long currentTime) {
        if (currentTime < lastUpdateTime) {
            throw new TimingException(ErrorReason.CLOCK_REGRESSION,
                    "Time " + currentTime + " is earlier than the last charged submission at " + lastUpdateTime);
        }
    }

    private long elapsedSince(long submissionTime, long currentTime) {
        if (currentTime < submissionTime) {
            throw new TimingException(ErrorReason.CLOCK_REGRESSION,
                    "Time " + currentTime + " is before the submission time " + submissionTime);
        }
        return currentTime - submissionTime;
    }
}
