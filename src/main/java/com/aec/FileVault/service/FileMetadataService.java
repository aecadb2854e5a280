package com.aec.FileVault.service;

import com.aec.FileVault.Repository.StoredFileRepository;
import com.aec.FileVault.dto.FileMetadata;
import com.aec.FileVault.exception.FileVaultException;
import com.aec.FileVault.model.StoredFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Durable file records. Pure data access: ownership is enforced by {@link FileGatewayService},
 * except that listing is always filtered by owner.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileMetadataService {

    private final StoredFileRepository repo;

    public StoredFile create(Long ownerId, String storageKey, FileMetadata metadata) {
        StoredFile sf = StoredFile.builder()
                .ownerId(ownerId)
                .storageKey(storageKey)
                .filename(metadata.getFilename())
                .contentType(metadata.getContentType())
                .size(metadata.getSize())
                .uploadedAt(metadata.getUploadedAt())
                .build();
        try {
            StoredFile saved = repo.saveAndFlush(sf);
            log.info("Recorded file id={} owner={} key={} ({} bytes)",
                    saved.getId(), ownerId, storageKey, saved.getSize());
            return saved;
        } catch (DataAccessException e) {
            throw FileVaultException.storeUnavailable("File metadata store unavailable", e);
        }
    }

    public List<StoredFile> listByOwner(Long ownerId) {
        try {
            return repo.findByOwnerIdOrderByUploadedAtDescIdDesc(ownerId);
        } catch (DataAccessException e) {
            throw FileVaultException.storeUnavailable("File metadata store unavailable", e);
        }
    }

    public StoredFile getById(Long id) {
        try {
            return repo.findById(id)
                    .orElseThrow(() -> FileVaultException.notFound("File " + id + " not found"));
        } catch (DataAccessException e) {
            throw FileVaultException.storeUnavailable("File metadata store unavailable", e);
        }
    }

    public void deleteById(Long id) {
        try {
            repo.deleteById(id);
            log.info("File record {} deleted", id);
        } catch (DataAccessException e) {
            throw FileVaultException.storeUnavailable("File metadata store unavailable", e);
        }
    }
}
