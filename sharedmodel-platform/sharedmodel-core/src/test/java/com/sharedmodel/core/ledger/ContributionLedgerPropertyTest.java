package com.sharedmodel.core.ledger;

import com.sharedmodel.core.access.OwnershipGate;
import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.domain.Contribution;
import com.sharedmodel.core.domain.ContributionKey;
import com.sharedmodel.core.error.ArithmeticViolationException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the escrow balance of a single contribution.
 */
class ContributionLedgerPropertyTest {

    private static final Address TRAINER = Address.of("0x00000000000000000000000000000000000000e0");
    private static final Address ALICE = Address.of("0x00000000000000000000000000000000000000a1");
    private static final ContributionKey KEY = new ContributionKey("0x" + "01".repeat(32));

    /**
     * Property: the claimable amount never increases, never goes below zero, and a rejected debit
     * leaves it unchanged.
     */
    @Property(tries = 200)
    void claimableAmountIsMonotone(@ForAll @LongRange(min = 0, max = 1_000_000) long deposit,
                                   @ForAll @Size(max = 20) List<@LongRange(min = 0, max = 300_000) Long> debits) {
        ContributionLedger ledger = new ContributionLedger(new OwnershipGate("ledger", TRAINER));
        ledger.record(TRAINER, KEY, 1, 10, ALICE, BigInteger.valueOf(deposit));

        BigInteger previous = BigInteger.valueOf(deposit);
        for (long debit : debits) {
            try {
                ledger.debit(TRAINER, KEY, BigInteger.valueOf(debit));
                assertThat(previous.longValue()).isGreaterThanOrEqualTo(debit);
            } catch (ArithmeticViolationException e) {
                assertThat(debit).isGreaterThan(previous.longValue());
            }
            BigInteger current = ledger.getClaimableAmount(KEY, 1, 10, ALICE);
            assertThat(current).isLessThanOrEqualTo(previous);
            assertThat(current.signum()).isGreaterThanOrEqualTo(0);
            previous = current;
        }
        assertThat(ledger.getInitialDeposit(KEY, 1, 10, ALICE)).isEqualTo(BigInteger.valueOf(deposit));
    }

    /**
     * Property: numClaims counts every claim while the claimant set holds each address once.
     */
    @Property(tries = 100)
    void claimantsAreRecordedOnce(@ForAll @Size(min = 1, max = 10) List<@IntRange(min = 1, max = 4) Integer> claimants) {
        ContributionLedger ledger = new ContributionLedger(new OwnershipGate("ledger", TRAINER));
        ledger.record(TRAINER, KEY, 1, 10, ALICE, BigInteger.TEN);

        for (int n : claimants) {
            ledger.claimReport(TRAINER, KEY, Address.of(String.format("0x%040x", n)));
        }

        Contribution view = ledger.lookup(KEY, 1, 10, ALICE);
        assertThat(view.numClaims()).isEqualTo(claimants.size());
        assertThat(view.claimedBy()).hasSize((int) claimants.stream().distinct().count());
    }
}
