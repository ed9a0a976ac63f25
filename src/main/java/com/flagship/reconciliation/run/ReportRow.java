package com.flagship.reconciliation.run;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.reconciliation.matching.ScoredCandidate;
import com.flagship.reconciliation.matching.StrategyKind;
import com.flagship.reconciliation.record.RecordFamily;
import lombok.Value;

/**
 * One line of a run report: the record, the candidate it was weighed against (if any)
 * and what happened.
 */
@Value
@JsonPropertyOrder({"record_family", "record_id", "candidate_id", "strategy", "confidence", "outcome", "detail"})
public class ReportRow {
    @JsonProperty("record_family")
    RecordFamily family;
    @JsonProperty("record_id")
    long recordId;
    @JsonProperty("candidate_id")
    Long candidateId;
    StrategyKind strategy;
    Integer confidence;
    ReportOutcome outcome;
    String detail;

    public static ReportRow forCandidate(RecordFamily family, long recordId, ScoredCandidate candidate,
                                         ReportOutcome outcome, String detail) {
        return new ReportRow(family, recordId, candidate.candidateId(), candidate.getStrategy(),
            candidate.getConfidence(), outcome, detail);
    }

    public static ReportRow withoutCandidate(RecordFamily family, long recordId, ReportOutcome outcome,
                                             String detail) {
        return new ReportRow(family, recordId, null, null, null, outcome, detail);
    }
}
