package com.flagship.reconciliation.record;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read/write access to the ledger, financial record and aggregate tables.
 *
 * Writes here are primitives; callers go through the safety guard and the linkage ledger.
 */
public interface RecordStore {

    Optional<LedgerTransaction> findLedgerTransaction(long id);

    Optional<FinancialRecord> findFinancialRecord(long id);

    Optional<Aggregate> findAggregate(long id);

    Optional<Aggregate> findAggregateByReserveNumber(String reserveNumber);

    /** Every aggregate in ascending id order. */
    List<Aggregate> findAllAggregates();

    /** Linked and unlinked counts and absolute amounts for one record family. */
    LinkCoverage coverage(RecordFamily family);

    List<LedgerTransaction> findLedgerTransactions(MatchCondition condition);

    List<FinancialRecord> findFinancialRecords(MatchCondition condition);

    List<LedgerTransaction> findLedgerTransactionsByNaturalKey(String naturalKey, boolean excludeLinked);

    List<FinancialRecord> findFinancialRecordsByNaturalKey(String naturalKey, boolean excludeLinked);

    /** Unlinked ledger transaction ids in ascending order. */
    List<Long> findUnlinkedLedgerTransactionIds();

    /** Financial record ids without a ledger link, in ascending order. */
    List<Long> findUnlinkedFinancialRecordIds();

    /** Records carrying a reserve number but no aggregate reference, in ascending id order. */
    List<FinancialRecord> findRecordsAwaitingAggregate();

    boolean ledgerTransactionExists(long id);

    boolean financialRecordExists(long id);

    boolean aggregateExists(long id);

    void insertLedgerTransaction(LedgerTransaction transaction);

    void insertFinancialRecord(FinancialRecord record);

    void insertAggregate(Aggregate aggregate);

    void setLedgerLinkReference(long ledgerTransactionId, UUID linkId);

    void clearLedgerLinkReference(long ledgerTransactionId);

    void assignAggregate(long financialRecordId, long aggregateId);

    void clearAggregate(long financialRecordId);

    void updateAggregateBalance(long aggregateId, BigDecimal amountPaid, BigDecimal balance);

    int deleteLedgerTransactions(Collection<Long> ids);
}
