package com.aec.FileVault.dto;

import lombok.*;

import java.time.Instant;

@Getter @AllArgsConstructor @Builder
public class IssuedSession {
    private final String token;
    private final String tokenId;
    private final Instant issuedAt;
    private final Instant expiresAt;
}
