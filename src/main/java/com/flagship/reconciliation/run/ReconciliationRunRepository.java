package com.flagship.reconciliation.run;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ReconciliationRunRepository extends JpaRepository<ReconciliationRunEntity, UUID> {

    List<ReconciliationRunEntity> findTop20ByOrderByStartedAtDesc();
}
