package com.aec.FileVault.dto;

import lombok.*;

/** What a verified Google ID token says about its holder. */
@Getter @AllArgsConstructor @Builder @ToString
public class VerifiedIdentity {
    private final String subject;
    private final String name;
    private final String email;
}
