package com.sharedmodel.core.trainer;

import com.sharedmodel.core.commitment.ContributionCommitment;
import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.domain.Contribution;
import com.sharedmodel.core.domain.ContributionKey;
import com.sharedmodel.core.domain.ReportClaim;
import com.sharedmodel.core.error.EconomicException;
import com.sharedmodel.core.error.ErrorReason;
import com.sharedmodel.core.error.ValidationException;
import com.sharedmodel.core.event.ContributionAdded;
import com.sharedmodel.core.event.ContributionEvent;
import com.sharedmodel.core.event.ContributionEventSink;
import com.sharedmodel.core.event.RefundIssued;
import com.sharedmodel.core.event.ReportRewarded;
import com.sharedmodel.core.incentive.StakingIncentiveEngine;
import com.sharedmodel.core.ledger.ContributionLedger;
import com.sharedmodel.core.math.UintMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for participants: sequences ledger, incentive engine and classifier, then pays out.
 *
 * <p>The trainer acts under its own address, which must hold both the ledger's and the engine's
 * gate. Submissions are serialized because each one restarts the engine's pricing clock. A claim
 * runs lookup, prediction, adjudication, claim marking and debit under the contribution's key
 * lock, and any failure along the way leaves every component untouched. Events are published and
 * value moved only after those locks are released. A failing event sink is logged and never
 * stops a payout that the ledger already committed.
 *
 * @param <S> sample type
 */
public class CollaborativeTrainer<S> {

    private static final Logger log = LoggerFactory.getLogger(CollaborativeTrainer.class);

    private final Address self;
    private final ContributionLedger ledger;
    private final StakingIncentiveEngine<S> engine;
    private final Classifier<S> classifier;
    private final ContributionCommitment<S> commitment;
    private final ValueTransfer valueTransfer;
    private final ContributionEventSink<S> events;
    private final ReentrantLock submissionLock = new ReentrantLock();

    public CollaborativeTrainer(Address self,
                                ContributionLedger ledger,
                                StakingIncentiveEngine<S> engine,
                                Classifier<S> classifier,
                                ContributionCommitment<S> commitment,
                                ValueTransfer valueTransfer,
                                ContributionEventSink<S> events) {
        this.self = Objects.requireNonNull(self, "Trainer address cannot be null");
        this.ledger = Objects.requireNonNull(ledger, "Ledger cannot be null");
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
        this.classifier = Objects.requireNonNull(classifier, "Classifier cannot be null");
        this.commitment = Objects.requireNonNull(commitment, "Commitment cannot be null");
        this.valueTransfer = Objects.requireNonNull(valueTransfer, "Value transfer cannot be null");
        this.events = Objects.requireNonNull(events, "Event sink cannot be null");
    }

    /**
     * Prices the submission, trains on it and escrows its cost as the deposit.
     * Any payment above the cost goes back to the submitter.
     */
    public SubmissionReceipt addData(Address submitter, S sample, long label,
                                     BigInteger paidAmount, long currentTime) {
        Objects.requireNonNull(submitter, "Submitter cannot be null");
        UintMath.requireUint(paidAmount);
        ContributionKey key = commitment.compute(sample, label, currentTime, submitter);

        BigInteger cost;
        submissionLock.lock();
        try {
            cost = ledger.withKeyLock(key, () -> {
                if (ledger.isLive(key)) {
                    throw new ValidationException(ErrorReason.KEY_COLLISION,
                            "This data was already added and still holds a deposit: " + key);
                }
                requireGates();
                engine.verifyClock(currentTime);
                BigInteger quoted = engine.quoteCost(sample, label, currentTime);
                if (paidAmount.compareTo(quoted) < 0) {
                    throw new EconomicException(ErrorReason.INSUFFICIENT_PAYMENT,
                            "Paid " + paidAmount + " but the submission costs " + quoted);
                }
                BigInteger charged = engine.chargeForSubmission(self, paidAmount, sample, label, currentTime);
                ledger.record(self, key, label, currentTime, submitter, charged);
                classifier.update(sample, label);
                return charged;
            });
        } finally {
            submissionLock.unlock();
        }

        log.info("Contribution {} added by {} with deposit {}", key, submitter, cost);
        publish(new ContributionAdded<>(key, sample, label, currentTime, submitter, cost));

        BigInteger change = UintMath.sub(paidAmount, cost);
        if (change.signum() > 0) {
            valueTransfer.transfer(submitter, change);
        }
        return new SubmissionReceipt(key, label, currentTime, submitter, cost, change);
    }

    /**
     * Returns the remaining deposit to its submitter once the model agrees with the label.
     */
    public ClaimPayout refund(Address submitter, S sample, long label, long addedTime, long currentTime) {
        Objects.requireNonNull(submitter, "Submitter cannot be null");
        ContributionKey key = commitment.compute(sample, label, addedTime, submitter);

        BigInteger amount = ledger.withKeyLock(key, () -> {
            requireGates();
            BigInteger claimable = ledger.getClaimableAmount(key, label, addedTime, submitter);
            boolean claimed = ledger.hasClaimed(key, label, addedTime, submitter, submitter);
            long prediction = classifier.predict(sample);
            BigInteger refund = engine.adjudicateRefund(self, submitter, addedTime, currentTime,
                    claimable, claimed, prediction, label);
            ledger.claimRefund(self, key, submitter);
            return refund;
        });

        log.info("Refunded {} to {} for contribution {}", amount, submitter, key);
        publish(new RefundIssued<>(key, sample, label, addedTime, submitter, amount));
        String transferId = valueTransfer.transfer(submitter, amount);
        return new ClaimPayout(key, submitter, amount, transferId);
    }

    /**
     * Pays a reporter out of a contribution the model disagrees with, or sweeps one that was left
     * unclaimed past its wait period.
     */
    public ClaimPayout report(Address reporter, S sample, long label, long addedTime,
                              Address originalAuthor, long currentTime) {
        Objects.requireNonNull(reporter, "Reporter cannot be null");
        Objects.requireNonNull(originalAuthor, "Original author cannot be null");
        ContributionKey key = commitment.compute(sample, label, addedTime, originalAuthor);

        BigInteger amount = ledger.withKeyLock(key, () -> {
            requireGates();
            Contribution contribution = ledger.lookup(key, label, addedTime, originalAuthor);
            long prediction = classifier.predict(sample);
            BigInteger reward = engine.adjudicateReport(self, reporter, addedTime, currentTime,
                    originalAuthor, contribution.initialDeposit(), contribution.claimableAmount(),
                    contribution.hasClaimed(reporter), prediction, label);
            ReportClaim committed = ledger.claimReport(self, key, reporter);
            ledger.debit(self, committed.key(), reward);
            return reward;
        });

        log.info("Rewarded {} to {} for reporting contribution {}", amount, reporter, key);
        publish(new ReportRewarded<>(key, sample, label, addedTime, originalAuthor, reporter, amount));
        String transferId = valueTransfer.transfer(reporter, amount);
        return new ClaimPayout(key, reporter, amount, transferId);
    }

    /**
     * Fails before any mutation if this trainer no longer holds the ledger or the engine gate.
     */
    private void requireGates() {
        ledger.getGate().require(self);
        engine.getOrchestratorGate().require(self);
    }

    private void publish(ContributionEvent<S> event) {
        try {
            events.publish(event);
        } catch (RuntimeException e) {
            log.error("Event sink failed for {} on contribution {} (amount {}); continuing with payout",
                    event.getClass().getSimpleName(), event.key(), event.amount(), e);
        }
    }

    public BigInteger quote(long currentTime) {
        return engine.quoteCost(currentTime);
    }

    public long predict(S sample) {
        return classifier.predict(sample);
    }

    public ContributionKey keyOf(S sample, long label, long addedTime, Address submitter) {
        return commitment.compute(sample, label, addedTime, submitter);
    }

    public Address getAddress() { return self; }
    public ContributionLedger getLedger() { return ledger; }
    public StakingIncentiveEngine<S> getEngine() { return engine; }
}
