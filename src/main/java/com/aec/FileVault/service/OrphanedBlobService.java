package com.aec.FileVault.service;

import com.aec.FileVault.Repository.OrphanedBlobRepository;
import com.aec.FileVault.Repository.StoredFileRepository;
import com.aec.FileVault.exception.FileVaultException;
import com.aec.FileVault.model.OrphanedBlob;
import com.aec.FileVault.storage.ObjectStorageGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Blobs left behind without a metadata record (failed compensating delete, failed delete after the
 * record was removed). They are persisted here and deleted later by {@link #reconcile()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrphanedBlobService {

    private static final int MAX_REASON = 512;
    private static final int BATCH_SIZE = 100;

    private final OrphanedBlobRepository repo;
    private final StoredFileRepository files;
    private final ObjectStorageGateway storage;
    private final Clock clock;

    public void register(String storageKey, String reason) {
        log.error("ORPHANED BLOB key={} reason={}", storageKey, reason);
        try {
            if (repo.findByStorageKey(storageKey).isPresent()) {
                return;
            }
            repo.save(OrphanedBlob.builder()
                    .storageKey(storageKey)
                    .reason(truncate(reason))
                    .detectedAt(clock.instant())
                    .attempts(0)
                    .build());
        } catch (DataAccessException e) {
            // the ERROR line above is the only trace left for manual reconciliation
            log.error("Could not persist orphaned blob key={}: {}", storageKey, e.getMessage(), e);
        }
    }

    @Scheduled(initialDelayString = "${filevault.orphans.reconcile-interval:PT10M}",
               fixedDelayString = "${filevault.orphans.reconcile-interval:PT10M}")
    public void reconcile() {
        List<OrphanedBlob> batch = repo.findReconcileBatch(PageRequest.of(0, BATCH_SIZE));
        int removed = 0;
        for (OrphanedBlob orphan : batch) {
            if (files.findByStorageKey(orphan.getStorageKey()).isPresent()) {
                log.warn("Blob {} is referenced by a file record again; dropping orphan entry", orphan.getStorageKey());
                repo.delete(orphan);
                continue;
            }
            orphan.setAttempts(orphan.getAttempts() + 1);
            orphan.setLastAttemptAt(clock.instant());
            try {
                storage.delete(orphan.getStorageKey());
                repo.delete(orphan);
                removed++;
            } catch (FileVaultException e) {
                log.warn("Orphan delete failed for key={} (attempt {}): {}",
                        orphan.getStorageKey(), orphan.getAttempts(), e.getMessage());
                repo.save(orphan);
            }
        }
        if (!batch.isEmpty()) {
            log.info("Orphan reconciliation: {} of {} blobs removed", removed, batch.size());
        }
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return "unknown";
        }
        return reason.length() > MAX_REASON ? reason.substring(0, MAX_REASON) : reason;
    }
}
