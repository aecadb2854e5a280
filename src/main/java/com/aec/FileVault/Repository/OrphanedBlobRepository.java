package com.aec.FileVault.Repository;

import com.aec.FileVault.model.OrphanedBlob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface OrphanedBlobRepository extends JpaRepository<OrphanedBlob, Long> {
    Optional<OrphanedBlob> findByStorageKey(String storageKey);

    // never-attempted entries first, then the one that waited longest since its last try
    @Query("select o from OrphanedBlob o order by o.lastAttemptAt asc nulls first, o.detectedAt asc, o.id asc")
    List<OrphanedBlob> findReconcileBatch(Pageable page);
}
