package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.record.FinancialRecord;
import com.flagship.reconciliation.record.LedgerTransaction;
import com.flagship.reconciliation.record.MatchCondition;
import com.flagship.reconciliation.record.RecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Produces a bounded, ordered set of counterpart candidates for one unmatched record.
 *
 * Lookups: natural key, amount range within the date window, and (account, amount)
 * within the wide window. Candidates already carrying a link, or claimed earlier in the
 * same run, are excluded. Natural-key candidates come first; the rest are ordered by date
 * distance then id and truncated to {@code maxCandidates}. Read-only.
 */
@Component
@RequiredArgsConstructor
public class CandidateGenerator {

    private static final int FETCH_FACTOR = 4;

    private final RecordStore recordStore;

    public List<CandidatePair> candidatesFor(LedgerTransaction subject, int windowDays,
                                             MatchingPolicy policy, Set<Long> claimed) {
        int fetchLimit = policy.getMaxCandidates() * FETCH_FACTOR;
        Map<Long, FinancialRecord> byKey = new LinkedHashMap<>();
        recordStore.findFinancialRecordsByNaturalKey(subject.getNaturalKey(), true)
            .forEach(record -> byKey.put(record.getId(), record));

        Map<Long, FinancialRecord> others = new LinkedHashMap<>();
        MatchCondition window = MatchCondition.around(subject.getAmount(), policy.getAmountTolerance(),
            subject.getPostingDate(), windowDays, fetchLimit);
        recordStore.findFinancialRecords(window).forEach(record -> others.putIfAbsent(record.getId(), record));

        if (subject.getAccountId() != null) {
            MatchCondition accountWindow = MatchCondition.around(subject.getAmount(), null,
                subject.getPostingDate(), policy.getWideWindowDays(), fetchLimit).forAccount(subject.getAccountId());
            recordStore.findFinancialRecords(accountWindow).forEach(record -> others.putIfAbsent(record.getId(), record));
        }

        List<CandidatePair> keyed = byKey.values().stream()
            .filter(record -> !claimed.contains(record.getId()))
            .map(record -> CandidatePair.forLedgerSubject(subject, record))
            .toList();
        List<CandidatePair> rest = others.values().stream()
            .filter(record -> !byKey.containsKey(record.getId()) && !claimed.contains(record.getId()))
            .map(record -> CandidatePair.forLedgerSubject(subject, record))
            .toList();
        return bounded(keyed, rest, policy.getMaxCandidates());
    }

    public List<CandidatePair> candidatesFor(FinancialRecord subject, int windowDays,
                                             MatchingPolicy policy, Set<Long> claimed) {
        int fetchLimit = policy.getMaxCandidates() * FETCH_FACTOR;
        Map<Long, LedgerTransaction> byKey = new LinkedHashMap<>();
        recordStore.findLedgerTransactionsByNaturalKey(subject.getNaturalKey(), true)
            .forEach(tx -> byKey.put(tx.getId(), tx));

        Map<Long, LedgerTransaction> others = new LinkedHashMap<>();
        MatchCondition window = MatchCondition.around(subject.getAmount(), policy.getAmountTolerance(),
            subject.getRecordDate(), windowDays, fetchLimit);
        recordStore.findLedgerTransactions(window).forEach(tx -> others.putIfAbsent(tx.getId(), tx));

        if (subject.getAccountId() != null) {
            MatchCondition accountWindow = MatchCondition.around(subject.getAmount(), null,
                subject.getRecordDate(), policy.getWideWindowDays(), fetchLimit).forAccount(subject.getAccountId());
            recordStore.findLedgerTransactions(accountWindow).forEach(tx -> others.putIfAbsent(tx.getId(), tx));
        }

        List<CandidatePair> keyed = byKey.values().stream()
            .filter(tx -> !claimed.contains(tx.getId()))
            .map(tx -> CandidatePair.forRecordSubject(subject, tx))
            .toList();
        List<CandidatePair> rest = others.values().stream()
            .filter(tx -> !byKey.containsKey(tx.getId()) && !claimed.contains(tx.getId()))
            .map(tx -> CandidatePair.forRecordSubject(subject, tx))
            .toList();
        return bounded(keyed, rest, policy.getMaxCandidates());
    }

    private List<CandidatePair> bounded(List<CandidatePair> keyed, List<CandidatePair> rest, int max) {
        List<CandidatePair> ordered = new ArrayList<>(keyed);
        rest.stream()
            .sorted(Comparator.comparingLong(CandidatePair::dateDistanceDays)
                .thenComparingLong(CandidatePair::candidateId))
            .forEach(ordered::add);
        return ordered.size() > max ? List.copyOf(ordered.subList(0, max)) : List.copyOf(ordered);
    }
}
