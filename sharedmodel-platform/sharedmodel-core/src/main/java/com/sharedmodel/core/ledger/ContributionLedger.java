package com.sharedmodel.core.ledger;

import com.sharedmodel.core.access.OwnershipGate;
import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.domain.Contribution;
import com.sharedmodel.core.domain.ContributionKey;
import com.sharedmodel.core.domain.RefundClaim;
import com.sharedmodel.core.domain.ReportClaim;
import com.sharedmodel.core.error.ArithmeticViolationException;
import com.sharedmodel.core.error.ErrorReason;
import com.sharedmodel.core.error.ValidationException;
import com.sharedmodel.core.math.UintMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-contribution escrow ledger keyed by content commitment.
 *
 * <p>Keys hash onto a fixed set of lock stripes; every operation on a key runs entirely under
 * its stripe, so two operations on the same key never interleave and each sees the effects of
 * the one before. The stripe count is fixed at construction, so lookups of unknown keys never
 * allocate lock state.
 * Records are never removed. A drained record that is superseded by a new submission under the
 * same key moves to that key's history.
 *
 * <p>Mutations are accepted only from the holder of the ledger's {@link OwnershipGate}.
 */
public class ContributionLedger {

    private static final Logger log = LoggerFactory.getLogger(ContributionLedger.class);

    static final int DEFAULT_STRIPES = 64;

    private final OwnershipGate gate;
    private final Map<ContributionKey, ContributionRecord> records = new ConcurrentHashMap<>();
    private final Map<ContributionKey, List<Contribution>> superseded = new ConcurrentHashMap<>();
    private final ReentrantLock[] stripes;

    public ContributionLedger(OwnershipGate gate) {
        this(gate, DEFAULT_STRIPES);
    }

    public ContributionLedger(OwnershipGate gate, int stripeCount) {
        this.gate = Objects.requireNonNull(gate, "Gate cannot be null");
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("Stripe count must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Runs {@code unit} while holding the lock of {@code key}. Ledger calls made by the unit on
     * the same key re-enter the lock.
     */
    public <T> T withKeyLock(ContributionKey key, Supplier<T> unit) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return unit.get();
        } finally {
            lock.unlock();
        }
    }

    public Contribution record(Address caller, ContributionKey key, long label, long submissionTime,
                               Address submitter, BigInteger deposit) {
        gate.require(caller);
        Objects.requireNonNull(submitter, "Submitter cannot be null");
        if (submissionTime < 0) {
            throw new IllegalArgumentException("Submission time must not be negative");
        }
        UintMath.requireUint(deposit);
        return withKeyLock(key, () -> {
            ContributionRecord existing = records.get(key);
            if (existing != null && existing.isLive()) {
                throw new ValidationException(ErrorReason.KEY_COLLISION,
                        "A live contribution already exists for key " + key);
            }
            if (existing != null) {
                superseded.computeIfAbsent(key, k -> new ArrayList<>()).add(existing.snapshot());
            }
            ContributionRecord created = new ContributionRecord(key, label, submissionTime, submitter, deposit);
            records.put(key, created);
            log.debug("Recorded contribution {} from {} with deposit {}", key, submitter, deposit);
            return created.snapshot();
        });
    }

    // ==================== Tuple-validated lookups ====================

    public BigInteger getClaimableAmount(ContributionKey key, long label, long submissionTime, Address submitter) {
        return withKeyLock(key, () -> validated(key, label, submissionTime, submitter).getClaimableAmount());
    }

    public BigInteger getInitialDeposit(ContributionKey key, long label, long submissionTime, Address submitter) {
        return withKeyLock(key, () -> validated(key, label, submissionTime, submitter).getInitialDeposit());
    }

    public long getNumClaims(ContributionKey key, long label, long submissionTime, Address submitter) {
        return withKeyLock(key, () -> validated(key, label, submissionTime, submitter).getNumClaims());
    }

    public boolean hasClaimed(ContributionKey key, long label, long submissionTime, Address submitter,
                              Address claimant) {
        return withKeyLock(key, () -> validated(key, label, submissionTime, submitter).hasClaimed(claimant));
    }

    /**
     * Full view of the record at {@code key}, validated against the identifying tuple.
     */
    public Contribution lookup(ContributionKey key, long label, long submissionTime, Address submitter) {
        return withKeyLock(key, () -> validated(key, label, submissionTime, submitter).snapshot());
    }

    // ==================== Claims ====================

    /**
     * Drains the whole remaining balance and marks the claimant.
     *
     * @return the values seen before the drain
     */
    public RefundClaim claimRefund(Address caller, ContributionKey key, Address claimant) {
        gate.require(caller);
        Objects.requireNonNull(claimant, "Claimant cannot be null");
        return withKeyLock(key, () -> {
            ContributionRecord record = existing(key);
            RefundClaim claim = new RefundClaim(
                    record.getClaimableAmount(), record.hasClaimed(claimant), record.getNumClaims());
            record.setClaimableAmount(BigInteger.ZERO);
            record.markClaimed(claimant);
            return claim;
        });
    }

    /**
     * Marks the claimant without touching the balance; the reward is taken by {@link #debit}.
     *
     * @return the values seen before the claimant was marked
     */
    public ReportClaim claimReport(Address caller, ContributionKey key, Address claimant) {
        gate.require(caller);
        Objects.requireNonNull(claimant, "Claimant cannot be null");
        return withKeyLock(key, () -> {
            ContributionRecord record = existing(key);
            ReportClaim claim = new ReportClaim(record.getInitialDeposit(), record.getClaimableAmount(),
                    record.hasClaimed(claimant), record.getNumClaims(), key);
            record.markClaimed(claimant);
            return claim;
        });
    }

    public void debit(Address caller, ContributionKey key, BigInteger amount) {
        gate.require(caller);
        UintMath.requireUint(amount);
        withKeyLock(key, () -> {
            ContributionRecord record = existing(key);
            if (amount.compareTo(record.getClaimableAmount()) > 0) {
                throw new ArithmeticViolationException(ErrorReason.INSUFFICIENT_BALANCE,
                        "Debit of " + amount + " exceeds claimable " + record.getClaimableAmount() + " on " + key);
            }
            record.setClaimableAmount(UintMath.sub(record.getClaimableAmount(), amount));
            return null;
        });
    }

    // ==================== Views ====================

    public boolean isLive(ContributionKey key) {
        return withKeyLock(key, () -> {
            ContributionRecord record = records.get(key);
            return record != null && record.isLive();
        });
    }

    public Optional<Contribution> find(ContributionKey key) {
        return withKeyLock(key, () -> Optional.ofNullable(records.get(key)).map(ContributionRecord::snapshot));
    }

    /**
     * Drained records previously stored under {@code key}, oldest first.
     */
    public List<Contribution> history(ContributionKey key) {
        return withKeyLock(key, () -> List.copyOf(superseded.getOrDefault(key, List.of())));
    }

    public int size() {
        return records.size();
    }

    public OwnershipGate getGate() { return gate; }

    private ReentrantLock lockFor(ContributionKey key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return stripes[Math.floorMod(key.hashCode(), stripes.length)];
    }

    int lockCount() {
        return stripes.length;
    }

    private ContributionRecord existing(ContributionKey key) {
        ContributionRecord record = records.get(key);
        if (record == null) {
            throw new ValidationException(ErrorReason.NOT_FOUND, "No contribution for key " + key);
        }
        return record;
    }

    private ContributionRecord validated(ContributionKey key, long label, long submissionTime, Address submitter) {
        ContributionRecord record = existing(key);
        if (!record.matches(label, submissionTime, submitter)) {
            throw new ValidationException(ErrorReason.MISMATCH,
                    "Stored contribution " + key + " does not match the given label, time or submitter");
        }
        return record;
    }
}
