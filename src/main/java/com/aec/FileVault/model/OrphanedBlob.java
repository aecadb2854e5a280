package com.aec.FileVault.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** A blob with no metadata record whose delete has not succeeded yet. */
@Entity
@Table(name = "orphaned_blobs")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class OrphanedBlob {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String storageKey;

    @Column(nullable = false, length = 512)
    private String reason;

    @Column(nullable = false)
    private Instant detectedAt;

    @Column(nullable = false)
    private int attempts;

    private Instant lastAttemptAt;
}
