package com.aec.FileVault.service;

import com.aec.FileVault.Repository.AppUserRepository;
import com.aec.FileVault.dto.VerifiedIdentity;
import com.aec.FileVault.exception.ErrorKind;
import com.aec.FileVault.exception.FileVaultException;
import com.aec.FileVault.model.AppUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps Google subjects onto local users. The unique constraint on third_party_id decides
 * races between simultaneous first logins: the losing insert re-reads the winner's row.
 * Not transactional: each repository call runs in its own transaction, so a failed insert
 * leaves the re-read usable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserDirectoryService {

    private final AppUserRepository repo;
    private final Clock clock;

    public AppUser findOrCreate(VerifiedIdentity identity) {
        String subject = identity.getSubject();
        String email = normalizeEmail(identity.getEmail());
        try {
            Optional<AppUser> existing = repo.findByThirdPartyId(subject);
            if (existing.isPresent()) {
                return refreshProfile(existing.get(), identity.getName(), email);
            }
            AppUser created = repo.saveAndFlush(AppUser.builder()
                    .thirdPartyId(subject)
                    .name(identity.getName())
                    .email(email)
                    .createdAt(clock.instant())
                    .build());
            log.info("Created user id={} for subject={}", created.getId(), subject);
            return created;
        } catch (DataIntegrityViolationException e) {
            return resolveConflict(subject, email, e);
        } catch (DataAccessException e) {
            throw FileVaultException.storeUnavailable("User store unavailable", e);
        }
    }

    public AppUser getById(Long id) {
        try {
            return repo.findById(id)
                    .orElseThrow(() -> FileVaultException.notFound("User " + id + " not found"));
        } catch (DataAccessException e) {
            throw FileVaultException.storeUnavailable("User store unavailable", e);
        }
    }

    private AppUser resolveConflict(String subject, String email, DataIntegrityViolationException cause) {
        Optional<AppUser> winner;
        try {
            winner = repo.findByThirdPartyId(subject);
        } catch (DataAccessException e) {
            throw FileVaultException.storeUnavailable("User store unavailable", e);
        }
        if (winner.isPresent()) {
            log.info("Concurrent first login for subject={} resolved to user id={}", subject, winner.get().getId());
            return winner.get();
        }
        // the row that won was not ours: the email belongs to another identity
        throw new FileVaultException(ErrorKind.IDENTITY_CONFLICT,
                "Email " + email + " is already linked to another account", cause);
    }

    private AppUser refreshProfile(AppUser user, String name, String email) {
        boolean nameChanged = name != null && !name.equals(user.getName());
        boolean emailChanged = !email.equals(user.getEmail())
                && repo.findByEmail(email).map(other -> Objects.equals(other.getId(), user.getId())).orElse(true);
        if (!nameChanged && !emailChanged) {
            return user;
        }
        if (nameChanged) {
            user.setName(name);
        }
        if (emailChanged) {
            user.setEmail(email);
        }
        log.info("Refreshing profile of user id={}", user.getId());
        return repo.saveAndFlush(user);
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
