package com.aec.FileVault.controller;

import com.aec.FileVault.dto.ErrorResponse;
import com.aec.FileVault.exception.ErrorKind;
import com.aec.FileVault.exception.FileVaultException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(FileVaultException.class)
    public ResponseEntity<ErrorResponse> handleFileVault(FileVaultException e, HttpServletRequest request) {
        ErrorKind kind = e.getKind();
        if (kind.status().is5xxServerError()) {
            log.error("{} {} failed: {} ({})", request.getMethod(), request.getRequestURI(), kind, e.getMessage(), e);
        } else {
            log.info("{} {} rejected: {} ({})", request.getMethod(), request.getRequestURI(), kind, e.getMessage());
        }
        return body(kind, e.getMessage(), request);
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest request) {
        log.info("{} {} bad request: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        return body(ErrorKind.INVALID_REQUEST, "Malformed request", request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException e, HttpServletRequest request) {
        return body(ErrorKind.INVALID_REQUEST, "File exceeds the maximum upload size", request);
    }

    private static ResponseEntity<ErrorResponse> body(ErrorKind kind, String message, HttpServletRequest request) {
        return ResponseEntity.status(kind.status())
                .body(ErrorResponse.builder()
                        .error(kind.code())
                        .message(message)
                        .path(request.getRequestURI())
                        .build());
    }
}
