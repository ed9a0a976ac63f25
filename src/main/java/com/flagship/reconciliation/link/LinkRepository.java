package com.flagship.reconciliation.link;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LinkRepository extends JpaRepository<LinkEntity, UUID> {

    Optional<LinkEntity> findByLedgerTransactionId(Long ledgerTransactionId);

    Optional<LinkEntity> findByFinancialRecordIdAndLinkKind(Long financialRecordId, LinkKind linkKind);

    List<LinkEntity> findByFinancialRecordIdOrderByCreatedAt(Long financialRecordId);

    List<LinkEntity> findByRunIdOrderByCreatedAt(UUID runId);
}
