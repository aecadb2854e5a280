package com.aec.FileVault.service;

import com.aec.FileVault.Repository.RevokedSessionRepository;
import com.aec.FileVault.config.SessionProperties;
import com.aec.FileVault.dto.IssuedSession;
import com.aec.FileVault.dto.SessionClaims;
import com.aec.FileVault.exception.ErrorKind;
import com.aec.FileVault.exception.FileVaultException;
import com.aec.FileVault.model.AppUser;
import com.aec.FileVault.model.RevokedSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionTokenServiceTest {

    private static final String SECRET = "ZmlsZS12YXVsdC10ZXN0LXNlY3JldC1rZXktMzItYnl0ZXMhIQ==";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private RevokedSessionRepository revoked;

    private SessionProperties props;
    private AppUser user;

    @BeforeEach
    void setUp() {
        props = new SessionProperties();
        props.setSecret(SECRET);
        user = AppUser.builder().id(42L).name("Ada").email("ada@example.com").thirdPartyId("g-42").build();
    }

    private SessionTokenService at(Instant instant) {
        return new SessionTokenService(props, revoked, Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Test
    void validateReturnsUserIdRightAfterIssue() {
        IssuedSession issued = at(NOW).issue(user);

        SessionClaims claims = at(NOW).validate(issued.getToken());

        assertThat(claims.getUserId()).isEqualTo(42L);
        assertThat(claims.getTokenId()).isEqualTo(issued.getTokenId());
        assertThat(claims.getIssuedAt()).isEqualTo(NOW);
        assertThat(claims.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofHours(24)));
    }

    @Test
    void tokenExpiresAfterConfiguredTtl() {
        props.setTtl(Duration.ofMinutes(5));
        IssuedSession issued = at(NOW).issue(user);

        assertThat(at(NOW.plusSeconds(299)).validate(issued.getToken()).getUserId()).isEqualTo(42L);
        assertThatThrownBy(() -> at(NOW.plusSeconds(300)).validate(issued.getToken()))
                .isInstanceOf(FileVaultException.class)
                .extracting("kind").isEqualTo(ErrorKind.EXPIRED_TOKEN);
    }

    @Test
    void expiredTokenIsReportedAsExpiredNotInvalid() {
        IssuedSession issued = at(NOW).issue(user);

        assertThatThrownBy(() -> at(NOW.plus(Duration.ofHours(25))).validate(issued.getToken()))
                .isInstanceOf(FileVaultException.class)
                .extracting("kind").isEqualTo(ErrorKind.EXPIRED_TOKEN);
    }

    @Test
    void alteredPayloadIsInvalid() {
        String[] parts = at(NOW).issue(user).getToken().split("\\.");
        String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
        String forged = payload.replace("\"sub\":\"42\"", "\"sub\":\"43\"");
        assertThat(forged).isNotEqualTo(payload);

        String token = parts[0] + "."
                + Base64.getUrlEncoder().withoutPadding().encodeToString(forged.getBytes(StandardCharsets.UTF_8))
                + "." + parts[2];

        assertThatThrownBy(() -> at(NOW).validate(token))
                .isInstanceOf(FileVaultException.class)
                .extracting("kind").isEqualTo(ErrorKind.INVALID_TOKEN);
    }

    @Test
    void alteredSignatureIsInvalid() {
        String[] parts = at(NOW).issue(user).getToken().split("\\.");
        char first = parts[2].charAt(0);
        String signature = (first == 'A' ? 'B' : 'A') + parts[2].substring(1);
        String token = parts[0] + "." + parts[1] + "." + signature;

        assertThatThrownBy(() -> at(NOW).validate(token))
                .isInstanceOf(FileVaultException.class)
                .extracting("kind").isEqualTo(ErrorKind.INVALID_TOKEN);
    }

    @Test
    void tokenSignedWithAnotherKeyIsInvalid() {
        SessionProperties other = new SessionProperties();
        other.setSecret(Base64.getEncoder().encodeToString(
                "another-secret-that-is-long-enough-for-hs256".getBytes(StandardCharsets.UTF_8)));
        String token = new SessionTokenService(other, revoked, Clock.fixed(NOW, ZoneOffset.UTC))
                .issue(user).getToken();

        assertThatThrownBy(() -> at(NOW).validate(token))
                .isInstanceOf(FileVaultException.class)
                .extracting("kind").isEqualTo(ErrorKind.INVALID_TOKEN);
    }

    @Test
    void tokenFromAnotherIssuerIsInvalid() {
        SessionProperties other = new SessionProperties();
        other.setSecret(SECRET);
        other.setIssuer("someone-else");
        String token = new SessionTokenService(other, revoked, Clock.fixed(NOW, ZoneOffset.UTC))
                .issue(user).getToken();

        assertThatThrownBy(() -> at(NOW).validate(token))
                .isInstanceOf(FileVaultException.class)
                .extracting("kind").isEqualTo(ErrorKind.INVALID_TOKEN);
    }

    @Test
    void garbageIsInvalid() {
        assertThatThrownBy(() -> at(NOW).validate("not.a.jwt"))
                .isInstanceOf(FileVaultException.class)
                .extracting("kind").isEqualTo(ErrorKind.INVALID_TOKEN);
        assertThatThrownBy(() -> at(NOW).validate(""))
                .isInstanceOf(FileVaultException.class)
                .extracting("kind").isEqualTo(ErrorKind.INVALID_TOKEN);
    }

    @Test
    void revokedTokenIsRejected() {
        IssuedSession issued = at(NOW).issue(user);
        when(revoked.existsByTokenId(issued.getTokenId())).thenReturn(true);

        assertThatThrownBy(() -> at(NOW).validate(issued.getToken()))
                .isInstanceOf(FileVaultException.class)
                .extracting("kind").isEqualTo(ErrorKind.INVALID_TOKEN);
    }

    @Test
    void revokeStoresTokenIdUntilExpiry() {
        SessionTokenService service = at(NOW);
        SessionClaims claims = service.validate(service.issue(user).getToken());

        service.revoke(claims);

        ArgumentCaptor<RevokedSession> captor = ArgumentCaptor.forClass(RevokedSession.class);
        verify(revoked).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getTokenId()).isEqualTo(claims.getTokenId());
        assertThat(captor.getValue().getUserId()).isEqualTo(42L);
        assertThat(captor.getValue().getExpiresAt()).isEqualTo(claims.getExpiresAt());
    }

    @Test
    void shortSecretIsRefusedAtStartup() {
        props.setSecret(Base64.getEncoder().encodeToString("too-short".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> at(NOW)).isInstanceOf(IllegalStateException.class);
    }
}
