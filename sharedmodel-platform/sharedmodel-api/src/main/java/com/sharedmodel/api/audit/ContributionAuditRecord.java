package com.sharedmodel.api.audit;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit row for one committed contribution event. Holds the commitment and the
 * parties, never the raw sample.
 */
@Entity
@Table(name = "contribution_audit_records", indexes = {
    @Index(name = "idx_audit_contribution_key", columnList = "contribution_key"),
    @Index(name = "idx_audit_recipient", columnList = "recipient")
})
public class ContributionAuditRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private EventType eventType;

    @NotNull
    @Column(name = "contribution_key", nullable = false, length = 66)
    private String contributionKey;

    @Column(nullable = false)
    private long label;

    @Column(name = "submission_time", nullable = false)
    private long submissionTime;

    @NotNull
    @Column(name = "submitter", nullable = false, length = 42)
    private String submitter;

    @Column(name = "recipient", length = 42)
    private String recipient;

    @NotNull
    @PositiveOrZero
    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Column(name = "sample_dimension", nullable = false)
    private int sampleDimension;

    @NotNull
    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    protected ContributionAuditRecord() {}

    public static ContributionAuditRecord create(EventType eventType, String contributionKey, long label,
                                                 long submissionTime, String submitter, String recipient,
                                                 BigInteger amount, int sampleDimension, Instant recordedAt) {
        var record = new ContributionAuditRecord();
        record.eventType = eventType;
        record.contributionKey = contributionKey;
        record.label = label;
        record.submissionTime = submissionTime;
        record.submitter = submitter;
        record.recipient = recipient;
        record.amount = amount;
        record.sampleDimension = sampleDimension;
        record.recordedAt = recordedAt;
        return record;
    }

    // Getters
    public UUID getId() { return id; }
    public EventType getEventType() { return eventType; }
    public String getContributionKey() { return contributionKey; }
    public long getLabel() { return label; }
    public long getSubmissionTime() { return submissionTime; }
    public String getSubmitter() { return submitter; }
    public String getRecipient() { return recipient; }
    public BigInteger getAmount() { return amount; }
    public int getSampleDimension() { return sampleDimension; }
    public Instant getRecordedAt() { return recordedAt; }

    public enum EventType {
        CONTRIBUTION_ADDED, REFUND_ISSUED, REPORT_REWARDED
    }
}
