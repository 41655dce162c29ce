package com.sharedmodel.api.audit;

import com.sharedmodel.api.audit.ContributionAuditRecord.EventType;
import com.sharedmodel.core.event.ContributionAdded;
import com.sharedmodel.core.event.ContributionEvent;
import com.sharedmodel.core.event.RefundIssued;
import com.sharedmodel.core.event.ReportRewarded;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Appends an audit row for every committed contribution event, before the payout is attempted,
 * so a failed transfer can be reconciled against the trail.
 */
@Component
public class ContributionAuditListener {

    private static final Logger log = LoggerFactory.getLogger(ContributionAuditListener.class);

    private final ContributionAuditRepository repository;
    private final Clock clock;

    public ContributionAuditListener(ContributionAuditRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @EventListener
    public void onContributionEvent(ContributionEvent<?> event) {
        ContributionAuditRecord record = toRecord(event);
        repository.save(record);
        log.debug("Audited {} for {}", record.getEventType(), record.getContributionKey());
    }

    private ContributionAuditRecord toRecord(ContributionEvent<?> event) {
        String submitter;
        String recipient;
        EventType type;
        if (event instanceof ContributionAdded<?> added) {
            type = EventType.CONTRIBUTION_ADDED;
            submitter = added.submitter().value();
            recipient = null;
        } else if (event instanceof RefundIssued<?> refund) {
            type = EventType.REFUND_ISSUED;
            submitter = refund.submitter().value();
            recipient = refund.submitter().value();
        } else if (event instanceof ReportRewarded<?> report) {
            type = EventType.REPORT_REWARDED;
            submitter = report.originalAuthor().value();
            recipient = report.reporter().value();
        } else {
            throw new IllegalArgumentException("Unknown contribution event: " + event.getClass().getName());
        }
        return ContributionAuditRecord.create(
                type,
                event.key().hex(),
                event.label(),
                event.submissionTime(),
                submitter,
                recipient,
                event.amount(),
                sampleDimension(event.sample()),
                clock.instant());
    }

    private static int sampleDimension(Object sample) {
        return sample instanceof long[] vector ? vector.length : 0;
    }
}
