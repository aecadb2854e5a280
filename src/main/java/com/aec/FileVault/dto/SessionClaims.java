package com.aec.FileVault.dto;

import lombok.*;

import java.time.Instant;

/** Claims of a session token that passed signature, issuer, expiry and revocation checks. */
@Getter @AllArgsConstructor @Builder @ToString
public class SessionClaims {
    private final Long userId;
    private final String tokenId;
    private final Instant issuedAt;
    private final Instant expiresAt;
}
