package com.aec.FileVault.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "stored_files", indexes = @Index(name = "idx_stored_files_owner", columnList = "owner_id"))
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StoredFile {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private Long ownerId;

    // key of the blob in the bucket, never reused
    @Column(name = "storage_key", nullable = false, unique = true, updatable = false)
    private String storageKey;

    @Column(nullable = false)
    private String filename;

    @Column(nullable = false)
    private String contentType;    // MIME type

    @Column(nullable = false)
    private Long size;             // bytes

    @Column(nullable = false)
    private Instant uploadedAt;
}
