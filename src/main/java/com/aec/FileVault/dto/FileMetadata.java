package com.aec.FileVault.dto;

import lombok.*;

import java.time.Instant;

@Getter @AllArgsConstructor @Builder
public class FileMetadata {
    private final String filename;
    private final String contentType;
    private final long size;
    private final Instant uploadedAt;
}
