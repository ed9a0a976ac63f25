package com.flagship.reconciliation.run;

import com.flagship.reconciliation.record.RecordFamily;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UnresolvedItemRepository extends JpaRepository<UnresolvedItemEntity, UUID> {

    Optional<UnresolvedItemEntity> findByRecordFamilyAndRecordId(RecordFamily recordFamily, Long recordId);

    List<UnresolvedItemEntity> findByResolvedFalseOrderByRecordFamilyAscRecordIdAsc();
}
