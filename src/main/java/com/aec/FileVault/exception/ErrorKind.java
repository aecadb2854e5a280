package com.aec.FileVault.exception;

import org.springframework.http.HttpStatus;

/**
 * Every failure the gateway can report. The wire code is the lower-cased name.
 */
public enum ErrorKind {
    INVALID_ASSERTION(HttpStatus.UNAUTHORIZED, false),
    PROVIDER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, false),
    EXPIRED_TOKEN(HttpStatus.UNAUTHORIZED, false),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, false),
    FORBIDDEN(HttpStatus.FORBIDDEN, false),
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    STORAGE_FAILURE(HttpStatus.BAD_GATEWAY, true),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, false),
    IDENTITY_CONFLICT(HttpStatus.CONFLICT, false);

    private final HttpStatus status;
    private final boolean retryable;

    ErrorKind(HttpStatus status, boolean retryable) {
        this.status = status;
        this.retryable = retryable;
    }

    public HttpStatus status() { return status; }

    public boolean retryable() { return retryable; }

    public String code() { return name().toLowerCase(); }
}
