package com.aec.FileVault.dto;

import com.aec.FileVault.model.StoredFile;
import lombok.*;

import java.io.InputStream;

/** An authorized download: the record plus an open stream the caller must close. */
@Getter @AllArgsConstructor
public class FileDownload {
    private final StoredFile file;
    private final InputStream content;
}
