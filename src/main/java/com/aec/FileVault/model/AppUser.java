package com.aec.FileVault.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "app_users")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AppUser {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    // always lower-cased
    @Column(nullable = false, unique = true)
    private String email;

    // 'sub' claim of the Google ID token
    @Column(name = "third_party_id", nullable = false, unique = true, updatable = false)
    private String thirdPartyId;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
