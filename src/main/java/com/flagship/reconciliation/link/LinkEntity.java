package com.flagship.reconciliation.link;

import com.flagship.reconciliation.matching.StrategyKind;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the links table.
 *
 * No setters: a link row is written once by the linkage ledger and only ever
 * removed through a guarded unlink. Uniqueness of the ledger side and of the
 * (record, kind) pair is enforced by the schema.
 */
@Entity
@Table(name = "links")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LinkEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "link_kind", nullable = false, updatable = false)
    private LinkKind linkKind;

    @Enumerated(EnumType.STRING)
    @Column(name = "link_type", nullable = false, updatable = false)
    private LinkType linkType;

    @Column(name = "ledger_transaction_id", updatable = false)
    private Long ledgerTransactionId;

    @Column(name = "financial_record_id", nullable = false, updatable = false)
    private Long financialRecordId;

    @Column(name = "aggregate_id", updatable = false)
    private Long aggregateId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private StrategyKind strategy;

    @Column(nullable = false, updatable = false)
    private int confidence;

    @Column(nullable = false, updatable = false, length = 1000)
    private String provenance;

    @Column(name = "run_id", updatable = false)
    private UUID runId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static LinkEntity fromDomain(Link link) {
        return new LinkEntity(
            link.getId(),
            link.getKind(),
            link.getType(),
            link.getLedgerTransactionId(),
            link.getFinancialRecordId(),
            link.getAggregateId(),
            link.getStrategy(),
            link.getConfidence(),
            truncate(link.getProvenance()),
            link.getRunId(),
            null // createdAt - set by @PrePersist
        );
    }

    public Link toDomain() {
        return new Link(id, linkKind, linkType, ledgerTransactionId, financialRecordId, aggregateId,
            strategy, confidence, provenance, runId, createdAt);
    }

    private static String truncate(String provenance) {
        if (provenance == null || provenance.isBlank()) {
            throw new IllegalArgumentException("Link provenance is required");
        }
        return provenance.length() > 1000 ? provenance.substring(0, 1000) : provenance;
    }
}
