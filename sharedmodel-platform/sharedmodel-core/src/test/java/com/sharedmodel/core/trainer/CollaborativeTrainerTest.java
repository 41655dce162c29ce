package com.sharedmodel.core.trainer;

import com.sharedmodel.core.access.OwnershipGate;
import com.sharedmodel.core.commitment.ContributionCommitment;
import com.sharedmodel.core.commitment.Int64VectorCodec;
import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.domain.ContributionKey;
import com.sharedmodel.core.error.ErrorReason;
import com.sharedmodel.core.error.SharedModelException;
import com.sharedmodel.core.event.ContributionAdded;
import com.sharedmodel.core.event.ContributionEvent;
import com.sharedmodel.core.event.ContributionEventSink;
import com.sharedmodel.core.event.RefundIssued;
import com.sharedmodel.core.event.ReportRewarded;
import com.sharedmodel.core.incentive.IncentiveTerms;
import com.sharedmodel.core.incentive.StakingIncentiveEngine;
import com.sharedmodel.core.ledger.ContributionLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class CollaborativeTrainerTest {

    private static final Address TRAINER = Address.of("0x00000000000000000000000000000000000000e0");
    private static final Address OWNER = Address.of("0x00000000000000000000000000000000000000f0");
    private static final Address ALICE = Address.of("0x00000000000000000000000000000000000000a1");
    private static final Address BOB = Address.of("0x00000000000000000000000000000000000000b0");
    private static final long[] SAMPLE = {3, -1, 4};

    private ScriptedClassifier classifier;
    private InMemoryValueTransfer payouts;
    private List<ContributionEvent<long[]>> events;
    private CollaborativeTrainer<long[]> trainer;

    @BeforeEach
    void setUp() {
        classifier = new ScriptedClassifier();
        payouts = new InMemoryValueTransfer();
        events = new CopyOnWriteArrayList<>();
        trainer = trainer(payouts);
    }

    private CollaborativeTrainer<long[]> trainer(ValueTransfer valueTransfer) {
        return trainer(valueTransfer, events::add);
    }

    private CollaborativeTrainer<long[]> trainer(ValueTransfer valueTransfer, ContributionEventSink<long[]> sink) {
        ContributionLedger ledger = new ContributionLedger(new OwnershipGate("ledger", TRAINER));
        StakingIncentiveEngine<long[]> engine = new StakingIncentiveEngine<>(
                new OwnershipGate("incentive engine", TRAINER), OWNER,
                new IncentiveTerms(BigInteger.ONE, 60, 120, 240), 0);
        return new CollaborativeTrainer<>(TRAINER, ledger, engine, classifier,
                new ContributionCommitment<>(Int64VectorCodec.ofLength(3)), valueTransfer, events::add);
    }

    private static ErrorReason reasonOf(Throwable e) {
        return ((SharedModelException) e).getReason();
    }

    @Test
    void submissionEscrowsCostAndReturnsChange() {
        SubmissionReceipt receipt = trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(500), 100);

        // 3600 / isqrt(100)
        assertThat(receipt.cost()).isEqualTo(BigInteger.valueOf(360));
        assertThat(receipt.change()).isEqualTo(BigInteger.valueOf(140));
        assertThat(payouts.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(140));
        assertThat(trainer.getLedger().getClaimableAmount(receipt.key(), 1, 100, ALICE))
                .isEqualTo(BigInteger.valueOf(360));
        assertThat(classifier.updates).containsExactly(1L);
        assertThat(trainer.getEngine().getTotalSubmitted()).isEqualTo(1);
        assertThat(events).singleElement().isInstanceOf(ContributionAdded.class);
    }

    @Test
    void exactPaymentMovesNothingBack() {
        SubmissionReceipt receipt = trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(360), 100);

        assertThat(receipt.change()).isZero();
        assertThat(payouts.totalPaid()).isZero();
    }

    @Test
    void duplicateSubmissionCollidesWithoutSideEffects() {
        trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(360), 100);

        assertThatThrownBy(() -> trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(3600), 100))
                .extracting(CollaborativeTrainerTest::reasonOf)
                .isEqualTo(ErrorReason.KEY_COLLISION);
        assertThat(classifier.updates).hasSize(1);
        assertThat(trainer.getEngine().getTotalSubmitted()).isEqualTo(1);
        assertThat(events).hasSize(1);
    }

    @Test
    void underpaymentLeavesModelAndLedgerUntouched() {
        assertThatThrownBy(() -> trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(359), 100))
                .extracting(CollaborativeTrainerTest::reasonOf)
                .isEqualTo(ErrorReason.INSUFFICIENT_PAYMENT);
        assertThat(classifier.updates).isEmpty();
        assertThat(trainer.getLedger().size()).isZero();
        assertThat(trainer.getEngine().getLastUpdateTime()).isZero();
    }

    @Test
    void clockRegressionLeavesModelUntouched() {
        trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(360), 100);

        assertThatThrownBy(() -> trainer.addData(BOB, SAMPLE, 1, BigInteger.valueOf(10_000), 99))
                .extracting(CollaborativeTrainerTest::reasonOf)
                .isEqualTo(ErrorReason.CLOCK_REGRESSION);
        assertThat(classifier.updates).hasSize(1);
    }

    @Test
    void sampleOfWrongDimensionIsRejected() {
        assertThatThrownBy(() -> trainer.addData(ALICE, new long[] {1, 2}, 1, BigInteger.valueOf(3600), 100))
                .extracting(CollaborativeTrainerTest::reasonOf)
                .isEqualTo(ErrorReason.MISMATCH);
        assertThat(classifier.updates).isEmpty();
    }

    @Test
    void refundReturnsTheDepositOnce() {
        trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(360), 100);
        classifier.prediction = 1;

        ClaimPayout payout = trainer.refund(ALICE, SAMPLE, 1, 100, 160);

        assertThat(payout.amount()).isEqualTo(BigInteger.valueOf(360));
        assertThat(payout.transferId()).startsWith("local-");
        assertThat(payouts.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(360));
        assertThat(trainer.getEngine().getNumValid(ALICE)).isEqualTo(1);
        assertThat(events.get(1)).isInstanceOf(RefundIssued.class);

        assertThatThrownBy(() -> trainer.refund(ALICE, SAMPLE, 1, 100, 200))
                .extracting(CollaborativeTrainerTest::reasonOf)
                .isEqualTo(ErrorReason.ALREADY_CLAIMED);
        assertThat(payouts.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(360));
    }

    @Test
    void earlyRefundChangesNothing() {
        SubmissionReceipt receipt = trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(360), 100);
        classifier.prediction = 1;

        assertThatThrownBy(() -> trainer.refund(ALICE, SAMPLE, 1, 100, 159))
                .extracting(CollaborativeTrainerTest::reasonOf)
                .isEqualTo(ErrorReason.TOO_EARLY);
        assertThat(trainer.getLedger().getClaimableAmount(receipt.key(), 1, 100, ALICE))
                .isEqualTo(BigInteger.valueOf(360));
        assertThat(trainer.getLedger().getNumClaims(receipt.key(), 1, 100, ALICE)).isZero();
        assertThat(trainer.getEngine().getNumValid(ALICE)).isZero();
        assertThat(payouts.totalPaid()).isZero();
    }

    @Test
    void refundOfUnknownTupleIsNotFound() {
        trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(360), 100);

        assertThatThrownBy(() -> trainer.refund(ALICE, SAMPLE, 1, 101, 200))
                .extracting(CollaborativeTrainerTest::reasonOf)
                .isEqualTo(ErrorReason.NOT_FOUND);
    }

    @Test
    void reporterWithStandingTakesMeritShare() {
        trainer.addData(BOB, new long[] {1, 1, 1}, 1, BigInteger.valueOf(360), 100);
        classifier.prediction = 1;
        trainer.refund(BOB, new long[] {1, 1, 1}, 1, 100, 160);

        SubmissionReceipt bad = trainer.addData(ALICE, SAMPLE, 0, BigInteger.valueOf(360), 200);

        ClaimPayout payout = trainer.report(BOB, SAMPLE, 0, 200, ALICE, 260);

        assertThat(payout.amount()).isEqualTo(bad.cost());
        assertThat(trainer.getLedger().getClaimableAmount(bad.key(), 0, 200, ALICE)).isZero();
        assertThat(trainer.getLedger().hasClaimed(bad.key(), 0, 200, ALICE, BOB)).isTrue();
        assertThat(events.get(events.size() - 1)).isInstanceOfSatisfying(ReportRewarded.class,
                e -> assertThat(e.reporter()).isEqualTo(BOB));
    }

    @Test
    void selfReportIsRejected() {
        trainer.addData(ALICE, SAMPLE, 0, BigInteger.valueOf(360), 100);
        classifier.prediction = 1;

        assertThatThrownBy(() -> trainer.report(ALICE, SAMPLE, 0, 100, ALICE, 200))
                .extracting(CollaborativeTrainerTest::reasonOf)
                .isEqualTo(ErrorReason.SELF_REPORT);
    }

    @Test
    void ownerSweepsAbandonedDeposit() {
        SubmissionReceipt receipt = trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(360), 100);
        classifier.prediction = 1;

        ClaimPayout payout = trainer.report(OWNER, SAMPLE, 1, 100, ALICE, 220);

        assertThat(payout.amount()).isEqualTo(BigInteger.valueOf(360));
        assertThat(payouts.balanceOf(OWNER)).isEqualTo(BigInteger.valueOf(360));
        assertThat(trainer.getLedger().isLive(receipt.key())).isFalse();
    }

    @Test
    void drainedKeyCanBeSubmittedAgain() {
        ContributionKey key = trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(360), 100).key();
        classifier.prediction = 1;
        trainer.refund(ALICE, SAMPLE, 1, 100, 160);

        SubmissionReceipt again = trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(3600), 100);

        assertThat(again.key()).isEqualTo(key);
        assertThat(trainer.getLedger().isLive(key)).isTrue();
        assertThat(trainer.getLedger().history(key)).singleElement()
                .satisfies(old -> assertThat(old.claimableAmount()).isZero());
    }

    @Test
    void failedPayoutKeepsTheCommittedClaim() {
        List<Address> attempted = new ArrayList<>();
        CollaborativeTrainer<long[]> failing = trainer((to, amount) -> {
            attempted.add(to);
            throw new ValueTransferException("node unreachable");
        });
        SubmissionReceipt receipt = failing.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(360), 100);
        classifier.prediction = 1;

        assertThatThrownBy(() -> failing.refund(ALICE, SAMPLE, 1, 100, 160))
                .isInstanceOf(ValueTransferException.class);
        assertThat(attempted).containsExactly(ALICE);
        assertThat(failing.getLedger().getClaimableAmount(receipt.key(), 1, 100, ALICE)).isZero();
    }

    @Test
    void failingEventSinkStillPaysCommittedAmounts() {
        CollaborativeTrainer<long[]> unaudited = trainer(payouts, event -> {
            throw new IllegalStateException("audit db down");
        });

        SubmissionReceipt receipt = unaudited.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(500), 100);
        assertThat(payouts.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(140));

        classifier.prediction = 1;
        ClaimPayout payout = unaudited.refund(ALICE, SAMPLE, 1, 100, 160);

        assertThat(payout.amount()).isEqualTo(BigInteger.valueOf(360));
        assertThat(payouts.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(500));
        assertThat(unaudited.getLedger().getClaimableAmount(receipt.key(), 1, 100, ALICE)).isZero();
    }

    @Test
    void failingEventSinkStillPaysOwnerSweep() {
        CollaborativeTrainer<long[]> unaudited = trainer(payouts, event -> {
            throw new IllegalStateException("audit db down");
        });
        unaudited.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(360), 100);
        classifier.prediction = 1;

        ClaimPayout payout = unaudited.report(OWNER, SAMPLE, 1, 100, ALICE, 220);

        assertThat(payout.amount()).isEqualTo(BigInteger.valueOf(360));
        assertThat(payouts.balanceOf(OWNER)).isEqualTo(BigInteger.valueOf(360));
    }

    @Test
    void submissionWithoutLedgerGateTouchesNothing() {
        trainer.getLedger().getGate().transfer(TRAINER, BOB);

        assertThatThrownBy(() -> trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(500), 100))
                .extracting(CollaborativeTrainerTest::reasonOf)
                .isEqualTo(ErrorReason.UNAUTHORIZED);
        assertThat(classifier.updates).isEmpty();
        assertThat(trainer.getEngine().getTotalSubmitted()).isZero();
        assertThat(trainer.getEngine().getLastUpdateTime()).isZero();
        assertThat(trainer.getLedger().size()).isZero();
        assertThat(payouts.totalPaid()).isZero();
        assertThat(events).isEmpty();
    }

    @Test
    void submissionWithoutEngineGateTouchesNothing() {
        trainer.getEngine().getOrchestratorGate().transfer(TRAINER, BOB);

        assertThatThrownBy(() -> trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(500), 100))
                .extracting(CollaborativeTrainerTest::reasonOf)
                .isEqualTo(ErrorReason.UNAUTHORIZED);
        assertThat(classifier.updates).isEmpty();
        assertThat(trainer.getLedger().size()).isZero();
    }

    @Test
    void refundWithoutLedgerGateLeavesStandingUnchanged() {
        trainer.addData(ALICE, SAMPLE, 1, BigInteger.valueOf(360), 100);
        trainer.getLedger().getGate().transfer(TRAINER, BOB);
        classifier.prediction = 1;

        assertThatThrownBy(() -> trainer.refund(ALICE, SAMPLE, 1, 100, 160))
                .extracting(CollaborativeTrainerTest::reasonOf)
                .isEqualTo(ErrorReason.UNAUTHORIZED);
        assertThat(trainer.getEngine().getNumValid(ALICE)).isZero();
        assertThat(payouts.totalPaid()).isZero();
    }

    @Test
    void concurrentReportersNeverDrainMoreThanTheDeposit() throws Exception {
        int reporters = 10;
        classifier.prediction = 1;
        List<Address> addresses = new ArrayList<>();
        for (int i = 0; i < reporters; i++) {
            Address reporter = Address.of(String.format("0x%040x", 0x100 + i));
            addresses.add(reporter);
            long[] own = {i, i, i};
            trainer.addData(reporter, own, 1, BigInteger.valueOf(10_000), 100 + i);
            trainer.refund(reporter, own, 1, 100 + i, 1_000);
        }
        SubmissionReceipt bad = trainer.addData(ALICE, SAMPLE, 0, BigInteger.valueOf(10_000), 2_000);

        ExecutorService pool = Executors.newFixedThreadPool(reporters);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ClaimPayout>> results = new ArrayList<>();
        for (Address reporter : addresses) {
            results.add(pool.submit(() -> {
                start.await();
                return trainer.report(reporter, SAMPLE, 0, 2_000, ALICE, 2_100);
            }));
        }
        start.countDown();

        BigInteger paid = BigInteger.ZERO;
        for (Future<ClaimPayout> result : results) {
            paid = paid.add(result.get(10, TimeUnit.SECONDS).amount());
        }
        pool.shutdown();

        BigInteger remaining = trainer.getLedger().getClaimableAmount(bad.key(), 0, 2_000, ALICE);
        assertThat(paid).isLessThanOrEqualTo(bad.cost());
        assertThat(remaining).isEqualTo(bad.cost().subtract(paid));
        assertThat(trainer.getLedger().getNumClaims(bad.key(), 0, 2_000, ALICE)).isEqualTo(reporters);

        assertThatThrownBy(() -> trainer.report(addresses.get(0), SAMPLE, 0, 2_000, ALICE, 2_101))
                .extracting(CollaborativeTrainerTest::reasonOf)
                .isEqualTo(ErrorReason.ALREADY_CLAIMED);
    }

    static class ScriptedClassifier implements Classifier<long[]> {

        final List<Long> updates = new CopyOnWriteArrayList<>();
        volatile long prediction;

        @Override
        public void update(long[] sample, long label) {
            updates.add(label);
        }

        @Override
        public long predict(long[] sample) {
            return prediction;
        }
    }
}
