package com.aec.FileVault.service;

import com.aec.FileVault.dto.*;
import com.aec.FileVault.exception.ErrorKind;
import com.aec.FileVault.exception.FileVaultException;
import com.aec.FileVault.model.AppUser;
import com.aec.FileVault.model.StoredFile;
import com.aec.FileVault.storage.ObjectStorageGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Single choke point for every file operation. Each request carries its own session token;
 * the user is re-derived from it and ownership is checked before storage is touched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileGatewayService {

    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
    private static final Pattern EXTENSION = Pattern.compile("[a-z0-9]{1,10}");

    private final GoogleIdentityService identity;
    private final UserDirectoryService users;
    private final SessionTokenService sessions;
    private final FileMetadataService metadata;
    private final ObjectStorageGateway storage;
    private final OrphanedBlobService orphans;
    private final RetryExecutor retry;
    private final Clock clock;

    public LoginResponse login(String assertion) {
        VerifiedIdentity verified = retry.call("identity.verify", () -> identity.verify(assertion));
        AppUser user = retry.call("users.findOrCreate", () -> users.findOrCreate(verified));
        IssuedSession session = sessions.issue(user);
        log.info("Login OK -> userId={}, tokenId={}, expiresAt={}",
                user.getId(), session.getTokenId(), session.getExpiresAt());
        return LoginResponse.builder()
                .token(session.getToken())
                .expiresAt(session.getExpiresAt())
                .user(UserDto.from(user))
                .build();
    }

    /** Resolves the principal of an already validated session token to a live user. */
    public AppUser authenticate(Jwt principal) {
        if (principal == null) {
            throw new FileVaultException(ErrorKind.UNAUTHORIZED, "Authentication required");
        }
        SessionClaims claims = sessions.toClaims(principal);
        try {
            return retry.call("users.getById", () -> users.getById(claims.getUserId()));
        } catch (FileVaultException e) {
            if (e.getKind() == ErrorKind.NOT_FOUND) {
                log.warn("Session tokenId={} names unknown user id={}", claims.getTokenId(), claims.getUserId());
                throw new FileVaultException(ErrorKind.UNAUTHORIZED, "Unknown user", e);
            }
            throw e;
        }
    }

    public void logout(Jwt principal) {
        AppUser user = authenticate(principal);
        SessionClaims claims = sessions.toClaims(principal);
        retry.run("sessions.revoke", () -> sessions.revoke(claims));
        log.info("Logout -> userId={}, tokenId={}", user.getId(), claims.getTokenId());
    }

    public FileInfoDto upload(AppUser user, MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new FileVaultException(ErrorKind.INVALID_REQUEST, "The uploaded file is empty");
        }
        String filename = cleanFilename(file.getOriginalFilename());
        String contentType = normalizeContentType(file.getContentType());
        long size = file.getSize();
        String storageKey = newStorageKey(filename);

        log.info("Upload: userId={}, name={}, contentType={}, size={}, key={}",
                user.getId(), filename, contentType, size, storageKey);

        // blob first: a record must never point at a blob that was not fully written
        retry.run("storage.put", () -> {
            try (InputStream in = file.getInputStream()) {
                storage.put(storageKey, in, size, contentType);
            } catch (IOException e) {
                throw new FileVaultException(ErrorKind.INVALID_REQUEST, "Upload stream could not be read", e);
            }
        });

        FileMetadata meta = FileMetadata.builder()
                .filename(filename)
                .contentType(contentType)
                .size(size)
                .uploadedAt(clock.instant())
                .build();
        try {
            StoredFile sf = retry.call("metadata.create", () -> metadata.create(user.getId(), storageKey, meta));
            return FileInfoDto.from(sf);
        } catch (RuntimeException e) {
            compensateUpload(storageKey, e);
            throw e;
        }
    }

    public FileListResponse list(AppUser user) {
        return new FileListResponse(retry.call("metadata.listByOwner", () -> metadata.listByOwner(user.getId()))
                .stream()
                .map(FileInfoDto::from)
                .collect(Collectors.toList()));
    }

    public FileDownload download(AppUser user, Long fileId) {
        StoredFile sf = authorize(user, fileId);
        // rows written before content types were normalised may still hold raw client values
        sf.setContentType(normalizeContentType(sf.getContentType()));
        InputStream content = retry.call("storage.get", () -> storage.get(sf.getStorageKey()));
        log.info("Download: userId={}, fileId={}, key={}", user.getId(), fileId, sf.getStorageKey());
        return new FileDownload(sf, content);
    }

    /** Removes the record first so no record can outlive its blob; a blob left behind becomes an orphan. */
    public void delete(AppUser user, Long fileId) {
        StoredFile sf = authorize(user, fileId);
        retry.run("metadata.deleteById", () -> metadata.deleteById(sf.getId()));
        try {
            retry.run("storage.delete", () -> storage.delete(sf.getStorageKey()));
            log.info("Delete: userId={}, fileId={}, key={}", user.getId(), fileId, sf.getStorageKey());
        } catch (FileVaultException e) {
            orphans.register(sf.getStorageKey(), "blob delete failed after record " + fileId + " was removed: " + e.getMessage());
        }
    }

    private StoredFile authorize(AppUser user, Long fileId) {
        StoredFile sf = retry.call("metadata.getById", () -> metadata.getById(fileId));
        if (!sf.getOwnerId().equals(user.getId())) {
            log.warn("Forbidden: userId={} requested fileId={} owned by userId={}",
                    user.getId(), fileId, sf.getOwnerId());
            throw new FileVaultException(ErrorKind.FORBIDDEN, "You don't own this file");
        }
        return sf;
    }

    private void compensateUpload(String storageKey, RuntimeException cause) {
        log.warn("Metadata for key={} not recorded ({}); deleting blob", storageKey, cause.getMessage());
        try {
            storage.delete(storageKey);
        } catch (FileVaultException e) {
            orphans.register(storageKey, "compensating delete failed after metadata error: " + cause.getMessage());
        }
    }

    static String cleanFilename(String original) {
        if (!StringUtils.hasText(original)) {
            return "file";
        }
        String name = original.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).trim();
        return name.isEmpty() ? "file" : name;
    }

    /** A concrete MIME type for the stored object; anything unparseable becomes application/octet-stream. */
    public static String normalizeContentType(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return DEFAULT_CONTENT_TYPE;
        }
        try {
            MediaType type = MediaType.parseMediaType(contentType.trim());
            return type.isConcrete() ? type.toString() : DEFAULT_CONTENT_TYPE;
        } catch (InvalidMediaTypeException e) {
            log.debug("Unparseable content type '{}', storing as {}", contentType, DEFAULT_CONTENT_TYPE);
            return DEFAULT_CONTENT_TYPE;
        }
    }

    static String newStorageKey(String filename) {
        String key = UUID.randomUUID().toString();
        int dot = filename.lastIndexOf('.');
        if (dot > 0 && dot < filename.length() - 1) {
            String ext = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
            if (EXTENSION.matcher(ext).matches()) {
                return key + "." + ext;
            }
        }
        return key;
    }
}
