package com.aec.FileVault.dto;

import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class FileListResponse {
    private List<FileInfoDto> files;
}
