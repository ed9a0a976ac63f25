package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.record.FinancialRecord;
import com.flagship.reconciliation.record.LedgerTransaction;
import com.flagship.reconciliation.record.RecordFamily;
import lombok.Value;

import java.math.BigDecimal;
import java.time.temporal.ChronoUnit;

/**
 * A subject record and one proposed counterpart, always carried as (ledger, record)
 * whichever side drives the run.
 */
@Value
public class CandidatePair {
    RecordFamily subjectFamily;
    LedgerTransaction ledger;
    FinancialRecord record;

    public static CandidatePair forLedgerSubject(LedgerTransaction subject, FinancialRecord candidate) {
        return new CandidatePair(RecordFamily.LEDGER, subject, candidate);
    }

    public static CandidatePair forRecordSubject(FinancialRecord subject, LedgerTransaction candidate) {
        return new CandidatePair(RecordFamily.RECORDS, candidate, subject);
    }

    public long subjectId() {
        return subjectFamily == RecordFamily.LEDGER ? ledger.getId() : record.getId();
    }

    public long candidateId() {
        return subjectFamily == RecordFamily.LEDGER ? record.getId() : ledger.getId();
    }

    public long dateDistanceDays() {
        return Math.abs(ChronoUnit.DAYS.between(ledger.getPostingDate(), record.getRecordDate()));
    }

    /**
     * Absolute difference between the two absolute amounts.
     */
    public BigDecimal amountDelta() {
        return ledger.getAmount().abs().subtract(record.getAmount().abs()).abs();
    }

    public boolean amountsEqual() {
        return amountDelta().signum() == 0;
    }
}
