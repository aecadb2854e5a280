package com.aec.FileVault.dto;

import com.aec.FileVault.model.StoredFile;
import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class FileInfoDto {
    private Long id;
    private String filename;
    private Long size;
    private String contentType;
    private Instant uploadTime;

    public static FileInfoDto from(StoredFile sf) {
        return FileInfoDto.builder()
                .id(sf.getId())
                .filename(sf.getFilename())
                .size(sf.getSize())
                .contentType(sf.getContentType())
                .uploadTime(sf.getUploadedAt())
                .build();
    }
}
