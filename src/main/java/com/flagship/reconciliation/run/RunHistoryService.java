package com.flagship.reconciliation.run;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class RunHistoryService {

    private final ReconciliationRunRepository repository;

    /**
     * Stores the counts of a write-mode run. Dry runs leave no trace in the database.
     */
    @Transactional
    public void record(RunSummary summary) {
        if (!summary.isWriteEnabled()) {
            throw new IllegalArgumentException("Dry runs are not recorded in run history");
        }
        repository.save(ReconciliationRunEntity.fromSummary(summary));
        log.debug("Recorded run {} in history", summary.getRunId());
    }

    @Transactional(readOnly = true)
    public List<ReconciliationRunEntity> recent() {
        return repository.findTop20ByOrderByStartedAtDesc();
    }
}
