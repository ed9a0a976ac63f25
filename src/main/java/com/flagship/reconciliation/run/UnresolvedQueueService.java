package com.flagship.reconciliation.run;

import com.flagship.reconciliation.record.RecordFamily;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Queue of records a write-mode run could not settle (ambiguous, no candidate,
 * below threshold, conflict), consumed by the next run or by manual review.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UnresolvedQueueService {

    private final UnresolvedItemRepository repository;

    @Transactional
    public void record(RecordFamily family, long recordId, ReportOutcome outcome, String candidateSummary,
                       UUID runId) {
        if (!outcome.isUnresolved()) {
            throw new IllegalArgumentException("Outcome " + outcome + " does not belong in the unresolved queue");
        }
        repository.findByRecordFamilyAndRecordId(family, recordId)
            .ifPresentOrElse(
                existing -> existing.seenAgain(outcome, candidateSummary, runId),
                () -> repository.save(UnresolvedItemEntity.open(family, recordId, outcome, candidateSummary, runId)));
        log.debug("Queued {} {} as {}", family, recordId, outcome);
    }

    @Transactional
    public void markResolved(RecordFamily family, long recordId, UUID runId) {
        repository.findByRecordFamilyAndRecordId(family, recordId)
            .ifPresent(item -> item.resolve(runId));
    }

    @Transactional(readOnly = true)
    public List<UnresolvedItem> findOpen() {
        return repository.findByResolvedFalseOrderByRecordFamilyAscRecordIdAsc().stream()
            .map(UnresolvedItemEntity::toDomain)
            .toList();
    }
}
