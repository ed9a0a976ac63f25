package com.flagship.reconciliation.safety;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SnapshotRepository extends JpaRepository<SnapshotEntity, UUID> {

    Optional<SnapshotEntity> findBySnapshotTable(String snapshotTable);

    List<SnapshotEntity> findBySourceTableOrderByCreatedAt(String sourceTable);
}
