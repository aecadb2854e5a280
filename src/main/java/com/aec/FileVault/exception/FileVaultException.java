package com.aec.FileVault.exception;

public class FileVaultException extends RuntimeException {

    private final ErrorKind kind;

    public FileVaultException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FileVaultException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }

    public boolean isRetryable() { return kind.retryable(); }

    public static FileVaultException notFound(String message) {
        return new FileVaultException(ErrorKind.NOT_FOUND, message);
    }

    public static FileVaultException storeUnavailable(String message, Throwable cause) {
        return new FileVaultException(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
