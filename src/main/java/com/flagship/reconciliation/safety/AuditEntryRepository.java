package com.flagship.reconciliation.safety;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntryEntity, UUID> {

    List<AuditEntryEntity> findByOperationKindOrderByCreatedAt(OperationKind operationKind);

    @Query("""
        SELECT a FROM AuditEntryEntity a
        WHERE (a.targetTable = :table AND a.recordIds LIKE CONCAT('%', :recordId, '%'))
           OR a.relatedRecords LIKE CONCAT('%', :reference, '%')
        ORDER BY a.createdAt
        """)
    List<AuditEntryEntity> findTouching(@Param("table") String table,
                                        @Param("recordId") String recordId,
                                        @Param("reference") String reference);

    List<AuditEntryEntity> findByRunIdOrderByCreatedAt(UUID runId);
}
