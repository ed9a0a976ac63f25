package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.record.FinancialRecord;
import com.flagship.reconciliation.record.LedgerTransaction;
import com.flagship.reconciliation.record.MatchCondition;
import com.flagship.reconciliation.record.RecordNature;
import com.flagship.reconciliation.record.RecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Candidate generation tests against a mocked record store.
 */
@ExtendWith(MockitoExtension.class)
class CandidateGeneratorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 10);

    @Mock
    private RecordStore recordStore;

    private CandidateGenerator generator;
    private LedgerTransaction subject;

    @BeforeEach
    void setUp() {
        generator = new CandidateGenerator(recordStore);
        subject = LedgerTransaction.of(1, "ACC-1", DAY, new BigDecimal("-231.00"), "CHQ 1042")
            .withNaturalKey("NK-1");
    }

    @Test
    @DisplayName("Natural-key candidates come first, the rest by date distance then id, duplicates and claims removed")
    void ordersAndFiltersCandidates() {
        // Given
        FinancialRecord keyed = record(9, DAY.plusDays(6));
        FinancialRecord sameDay = record(2, DAY);
        FinancialRecord twoDays = record(3, DAY.minusDays(2));
        FinancialRecord claimedRecord = record(4, DAY);
        FinancialRecord accountOnly = record(5, DAY.plusDays(20));
        when(recordStore.findFinancialRecordsByNaturalKey("NK-1", true)).thenReturn(List.of(keyed));
        when(recordStore.findFinancialRecords(any())).thenAnswer(invocation -> {
            MatchCondition condition = invocation.getArgument(0);
            return condition.getAccountId() == null
                ? List.of(twoDays, keyed, claimedRecord, sameDay)
                : List.of(accountOnly, sameDay);
        });

        // When
        List<CandidatePair> candidates = generator.candidatesFor(subject, 3, MatchingPolicy.defaults(), Set.of(4L));

        // Then
        assertEquals(List.of(9L, 2L, 3L, 5L), candidates.stream().map(CandidatePair::candidateId).toList());
        assertTrue(candidates.stream().allMatch(pair -> pair.subjectId() == 1L));
    }

    @Test
    @DisplayName("The candidate list is truncated to the policy maximum")
    void truncatesToMaxCandidates() {
        when(recordStore.findFinancialRecords(any())).thenReturn(List.of(
            record(10, DAY.plusDays(3)), record(11, DAY), record(12, DAY.plusDays(1))));
        MatchingPolicy policy = MatchingPolicy.builder().maxCandidates(2).build();

        List<CandidatePair> candidates = generator.candidatesFor(subject, 3, policy, Set.of());

        assertEquals(List.of(11L, 12L), candidates.stream().map(CandidatePair::candidateId).toList());
    }

    @Test
    @DisplayName("Lookups use the tolerance range in the requested window and exact amount on the account in the wide window")
    void buildsLookupConditions() {
        // When
        generator.candidatesFor(subject, 7, MatchingPolicy.defaults(), Set.of());

        // Then
        ArgumentCaptor<MatchCondition> captor = ArgumentCaptor.forClass(MatchCondition.class);
        verify(recordStore, atLeastOnce()).findFinancialRecords(captor.capture());
        List<MatchCondition> conditions = captor.getAllValues();
        assertEquals(2, conditions.size());

        MatchCondition window = conditions.get(0);
        assertNull(window.getAccountId());
        assertEquals(0, new BigDecimal("219.45").compareTo(window.getMinAbsAmount()));
        assertEquals(0, new BigDecimal("242.55").compareTo(window.getMaxAbsAmount()));
        assertEquals(DAY.minusDays(7), window.getFromDate());
        assertEquals(DAY.plusDays(7), window.getToDate());
        assertEquals(200, window.getLimit());
        assertTrue(window.isExcludeLinked());

        MatchCondition account = conditions.get(1);
        assertEquals("ACC-1", account.getAccountId());
        assertEquals(0, new BigDecimal("231.00").compareTo(account.getMinAbsAmount()));
        assertEquals(0, new BigDecimal("231.00").compareTo(account.getMaxAbsAmount()));
        assertEquals(DAY.minusDays(30), account.getFromDate());
    }

    @Test
    @DisplayName("Record-driven generation returns ledger candidates")
    void recordSubject() {
        FinancialRecord payment = record(20, DAY);
        when(recordStore.findLedgerTransactions(any())).thenReturn(List.of(
            LedgerTransaction.of(7, "ACC-1", DAY.plusDays(1), new BigDecimal("-231.00"), null)));

        List<CandidatePair> candidates = generator.candidatesFor(payment, 3, MatchingPolicy.defaults(), Set.of());

        assertEquals(1, candidates.size());
        assertEquals(7L, candidates.get(0).candidateId());
        assertEquals(20L, candidates.get(0).subjectId());
    }

    private static FinancialRecord record(long id, LocalDate date) {
        return FinancialRecord.of(id, date, new BigDecimal("231.00"), RecordNature.PAYMENT);
    }
}
