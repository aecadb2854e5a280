package com.aec.FileVault.service;

import com.aec.FileVault.dto.VerifiedIdentity;
import com.aec.FileVault.exception.ErrorKind;
import com.aec.FileVault.exception.FileVaultException;
import com.google.api.client.googleapis.auth.oauth2.GoogleIdToken;
import com.google.api.client.googleapis.auth.oauth2.GoogleIdTokenVerifier;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.security.GeneralSecurityException;

/**
 * Verifies Google ID tokens: RS256 signature against Google's certificates,
 * audience against the configured client ids, issuer and expiry.
 */
@Slf4j
@Service
public class GoogleIdentityService {

    private final GoogleIdTokenVerifier verifier;
    private final JsonFactory jsonFactory = JacksonFactory.getDefaultInstance();

    public GoogleIdentityService(GoogleIdTokenVerifier verifier) {
        this.verifier = verifier;
    }

    public VerifiedIdentity verify(String assertion) {
        if (!StringUtils.hasText(assertion)) {
            throw new FileVaultException(ErrorKind.INVALID_ASSERTION, "Identity assertion is missing");
        }

        GoogleIdToken idToken;
        try {
            idToken = GoogleIdToken.parse(jsonFactory, assertion.trim());
        } catch (IOException | IllegalArgumentException e) {
            throw new FileVaultException(ErrorKind.INVALID_ASSERTION, "Malformed identity assertion", e);
        }

        boolean valid;
        try {
            valid = verifier.verify(idToken);
        } catch (IOException | GeneralSecurityException e) {
            log.warn("Google signing keys unavailable: {}", e.getMessage());
            throw new FileVaultException(ErrorKind.PROVIDER_UNAVAILABLE,
                    "Identity provider keys could not be fetched", e);
        }
        if (!valid) {
            log.info("Rejected Google ID token: aud={}, iss={}, exp={}",
                    idToken.getPayload().getAudience(), idToken.getPayload().getIssuer(),
                    idToken.getPayload().getExpirationTimeSeconds());
            throw new FileVaultException(ErrorKind.INVALID_ASSERTION, "Invalid Google ID token");
        }

        GoogleIdToken.Payload payload = idToken.getPayload();
        String subject = payload.getSubject();
        String email = payload.getEmail();
        if (!StringUtils.hasText(subject) || !StringUtils.hasText(email)) {
            throw new FileVaultException(ErrorKind.INVALID_ASSERTION, "Google ID token lacks subject or email");
        }
        Object name = payload.get("name");
        return VerifiedIdentity.builder()
                .subject(subject)
                .email(email)
                .name(name instanceof String && StringUtils.hasText((String) name) ? (String) name : email)
                .build();
    }
}
