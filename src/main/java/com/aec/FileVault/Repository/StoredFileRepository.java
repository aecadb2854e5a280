package com.aec.FileVault.Repository;

import com.aec.FileVault.model.StoredFile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface StoredFileRepository extends JpaRepository<StoredFile, Long> {
    List<StoredFile> findByOwnerIdOrderByUploadedAtDescIdDesc(Long ownerId);
    Optional<StoredFile> findByStorageKey(String storageKey);
}
