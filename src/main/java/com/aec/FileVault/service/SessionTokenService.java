package com.aec.FileVault.service;

import com.aec.FileVault.Repository.RevokedSessionRepository;
import com.aec.FileVault.config.SessionProperties;
import com.aec.FileVault.dto.IssuedSession;
import com.aec.FileVault.dto.SessionClaims;
import com.aec.FileVault.exception.ErrorKind;
import com.aec.FileVault.exception.FileVaultException;
import com.aec.FileVault.model.AppUser;
import com.aec.FileVault.model.RevokedSession;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.UUID;

/**
 * Issues and validates the HS256 session tokens handed out at login.
 * Tokens carry sub (user id), iat, exp, jti and iss; logout revokes by jti.
 */
@Slf4j
@Service
public class SessionTokenService {

    private static final int MIN_KEY_BYTES = 32;

    private final SessionProperties props;
    private final RevokedSessionRepository revoked;
    private final Clock clock;
    private final JwtEncoder encoder;
    private final NimbusJwtDecoder decoder;

    public SessionTokenService(SessionProperties props, RevokedSessionRepository revoked, Clock clock) {
        this.props = props;
        this.revoked = revoked;
        this.clock = clock;

        if (!StringUtils.hasText(props.getSecret())) {
            throw new IllegalStateException("filevault.session.secret must be set");
        }
        byte[] keyBytes = Base64.getDecoder().decode(props.getSecret());
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("filevault.session.secret must decode to at least 256 bits");
        }
        SecretKey key = new SecretKeySpec(keyBytes, "HmacSHA256");
        this.encoder = new NimbusJwtEncoder(new ImmutableSecret<>(key));
        this.decoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
        // expiry is checked against our Clock in decode() so it can be told apart from a bad signature
        this.decoder.setJwtValidator(new JwtIssuerValidator(props.getIssuer()));
    }

    public IssuedSession issue(AppUser user) {
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(props.getTtl());
        String tokenId = UUID.randomUUID().toString();

        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(props.getIssuer())
                .subject(String.valueOf(user.getId()))
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .id(tokenId)
                .claim("name", user.getName())
                .claim("email", user.getEmail())
                .build();
        String token = encoder.encode(JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims))
                .getTokenValue();

        return IssuedSession.builder()
                .token(token)
                .tokenId(tokenId)
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .build();
    }

    public SessionClaims validate(String token) {
        return toClaims(decode(token));
    }

    /**
     * Full validation returning the Spring {@link Jwt}, for the resource-server filter chain.
     * Fails with INVALID_TOKEN, EXPIRED_TOKEN or STORE_UNAVAILABLE.
     */
    public Jwt decode(String token) {
        if (!StringUtils.hasText(token)) {
            throw new FileVaultException(ErrorKind.INVALID_TOKEN, "Session token is missing");
        }
        Jwt jwt;
        try {
            jwt = decoder.decode(token);
        } catch (JwtException e) {
            throw new FileVaultException(ErrorKind.INVALID_TOKEN, "Invalid session token", e);
        }
        if (jwt.getExpiresAt() == null || jwt.getIssuedAt() == null
                || !StringUtils.hasText(jwt.getId()) || !StringUtils.hasText(jwt.getSubject())) {
            throw new FileVaultException(ErrorKind.INVALID_TOKEN, "Session token lacks required claims");
        }
        parseUserId(jwt.getSubject());
        if (!jwt.getExpiresAt().isAfter(clock.instant())) {
            throw new FileVaultException(ErrorKind.EXPIRED_TOKEN, "Session expired at " + jwt.getExpiresAt());
        }
        if (isRevoked(jwt.getId())) {
            throw new FileVaultException(ErrorKind.INVALID_TOKEN, "Session has been revoked");
        }
        return jwt;
    }

    public SessionClaims toClaims(Jwt jwt) {
        return SessionClaims.builder()
                .userId(parseUserId(jwt.getSubject()))
                .tokenId(jwt.getId())
                .issuedAt(jwt.getIssuedAt())
                .expiresAt(jwt.getExpiresAt())
                .build();
    }

    public void revoke(SessionClaims claims) {
        try {
            if (revoked.existsByTokenId(claims.getTokenId())) {
                return;
            }
            revoked.saveAndFlush(RevokedSession.builder()
                    .tokenId(claims.getTokenId())
                    .userId(claims.getUserId())
                    .expiresAt(claims.getExpiresAt())
                    .revokedAt(clock.instant())
                    .build());
            log.info("Revoked session tokenId={} of user id={}", claims.getTokenId(), claims.getUserId());
        } catch (DataIntegrityViolationException e) {
            log.debug("Session tokenId={} was revoked concurrently", claims.getTokenId());
        } catch (DataAccessException e) {
            throw FileVaultException.storeUnavailable("Revocation store unavailable", e);
        }
    }

    /** Revocations only matter until the token would have expired anyway. */
    @Scheduled(fixedDelayString = "${filevault.session.revocation-purge-interval:PT1H}")
    public void purgeExpiredRevocations() {
        int purged = revoked.deleteExpiredBefore(clock.instant());
        if (purged > 0) {
            log.info("Purged {} expired session revocations", purged);
        }
    }

    private boolean isRevoked(String tokenId) {
        try {
            return revoked.existsByTokenId(tokenId);
        } catch (DataAccessException e) {
            throw FileVaultException.storeUnavailable("Revocation store unavailable", e);
        }
    }

    private static Long parseUserId(String subject) {
        try {
            return Long.valueOf(subject);
        } catch (NumberFormatException e) {
            throw new FileVaultException(ErrorKind.INVALID_TOKEN, "Session subject is not a user id", e);
        }
    }
}
