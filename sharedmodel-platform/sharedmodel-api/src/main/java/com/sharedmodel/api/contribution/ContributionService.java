package com.sharedmodel.api.contribution;

import com.sharedmodel.api.audit.ContributionAuditRecord;
import com.sharedmodel.api.audit.ContributionAuditRepository;
import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.domain.Contribution;
import com.sharedmodel.core.domain.ContributionKey;
import com.sharedmodel.core.incentive.StakingIncentiveEngine;
import com.sharedmodel.core.trainer.ClaimPayout;
import com.sharedmodel.core.trainer.CollaborativeTrainer;
import com.sharedmodel.core.trainer.InMemoryValueTransfer;
import com.sharedmodel.core.trainer.SubmissionReceipt;
import com.sharedmodel.core.trainer.ValueTransfer;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Contribution lifecycle for API callers: reads the clock once per request and hands the
 * reading to the trainer.
 */
@Service
public class ContributionService {

    private final CollaborativeTrainer<long[]> trainer;
    private final ValueTransfer valueTransfer;
    private final ContributionAuditRepository auditRepository;
    private final Clock clock;

    public ContributionService(
            CollaborativeTrainer<long[]> trainer,
            ValueTransfer valueTransfer,
            ContributionAuditRepository auditRepository,
            Clock clock) {
        this.trainer = trainer;
        this.valueTransfer = valueTransfer;
        this.auditRepository = auditRepository;
        this.clock = clock;
    }

    public SubmissionReceipt submit(Address submitter, long[] sample, long label, BigInteger paidAmount) {
        return trainer.addData(submitter, sample, label, paidAmount, now());
    }

    public QuoteDto quote() {
        long now = now();
        return new QuoteDto(trainer.quote(now), now);
    }

    public ClaimPayout refund(Address submitter, long[] sample, long label, long addedTime) {
        return trainer.refund(submitter, sample, label, addedTime, now());
    }

    public ClaimPayout report(Address reporter, long[] sample, long label, long addedTime, Address originalAuthor) {
        return trainer.report(reporter, sample, label, addedTime, originalAuthor, now());
    }

    public Optional<ContributionDto> getContribution(ContributionKey key) {
        return trainer.getLedger().find(key).map(this::toDto);
    }

    public List<ContributionDto> getHistory(ContributionKey key) {
        return trainer.getLedger().history(key).stream().map(this::toDto).toList();
    }

    public List<AuditEntryDto> getAuditTrail(ContributionKey key) {
        return auditRepository.findByContributionKeyOrderByRecordedAtAsc(key.hex()).stream()
                .map(this::toDto)
                .toList();
    }

    public ParticipantDto getParticipant(Address address) {
        BigInteger balance = valueTransfer instanceof InMemoryValueTransfer inMemory
                ? inMemory.balanceOf(address)
                : null;
        return new ParticipantDto(address.value(), trainer.getEngine().getNumValid(address), balance);
    }

    public StatsDto getStats() {
        StakingIncentiveEngine<long[]> engine = trainer.getEngine();
        return new StatsDto(
                engine.getTotalSubmitted(),
                engine.getTotalGoodDataCount(),
                engine.getLastUpdateTime(),
                trainer.getLedger().size());
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private ContributionDto toDto(Contribution contribution) {
        return new ContributionDto(
                contribution.key().hex(),
                contribution.label(),
                contribution.submissionTime(),
                contribution.submitter().value(),
                contribution.initialDeposit(),
                contribution.claimableAmount(),
                contribution.numClaims(),
                contribution.claimedBy().stream().map(Address::value).sorted().toList(),
                contribution.isLive()
        );
    }

    private AuditEntryDto toDto(ContributionAuditRecord record) {
        return new AuditEntryDto(
                record.getEventType().name(),
                record.getSubmitter(),
                record.getRecipient(),
                record.getAmount(),
                record.getRecordedAt()
        );
    }

    public record QuoteDto(BigInteger cost, long currentTime) {}

    public record ContributionDto(
            String key,
            long label,
            long submissionTime,
            String submitter,
            BigInteger initialDeposit,
            BigInteger claimableAmount,
            long numClaims,
            List<String> claimedBy,
            boolean live
    ) {}

    public record AuditEntryDto(
            String eventType,
            String submitter,
            String recipient,
            BigInteger amount,
            Instant recordedAt
    ) {}

    public record ParticipantDto(String address, long numValid, BigInteger balance) {}

    public record StatsDto(long totalSubmitted, long totalGoodDataCount, long lastUpdateTime, int contributions) {}
}
