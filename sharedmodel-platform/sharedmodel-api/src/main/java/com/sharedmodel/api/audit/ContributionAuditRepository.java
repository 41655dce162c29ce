package com.sharedmodel.api.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ContributionAuditRepository extends JpaRepository<ContributionAuditRecord, UUID> {

    List<ContributionAuditRecord> findByContributionKeyOrderByRecordedAtAsc(String contributionKey);

    List<ContributionAuditRecord> findByRecipientOrderByRecordedAtAsc(String recipient);
}
