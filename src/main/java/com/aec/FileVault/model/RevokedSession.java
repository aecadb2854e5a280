package com.aec.FileVault.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** A session token invalidated by logout before its natural expiry. */
@Entity
@Table(name = "revoked_sessions")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RevokedSession {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // 'jti' claim
    @Column(nullable = false, unique = true)
    private String tokenId;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false)
    private Instant expiresAt;

    @Column(nullable = false)
    private Instant revokedAt;
}
