package com.aec.FileVault.controller;

import com.aec.FileVault.dto.FileDownload;
import com.aec.FileVault.dto.FileInfoDto;
import com.aec.FileVault.dto.FileListResponse;
import com.aec.FileVault.model.AppUser;
import com.aec.FileVault.model.StoredFile;
import com.aec.FileVault.service.FileGatewayService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.*;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

@RestController
@RequiredArgsConstructor
public class FileController {

    private final FileGatewayService gateway;

    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public FileInfoDto upload(@AuthenticationPrincipal Jwt jwt, @RequestPart("file") MultipartFile file) {
        AppUser user = gateway.authenticate(jwt);
        return gateway.upload(user, file);
    }

    @GetMapping("/files")
    public FileListResponse listFiles(@AuthenticationPrincipal Jwt jwt) {
        return gateway.list(gateway.authenticate(jwt));
    }

    @GetMapping("/download/{id}")
    public ResponseEntity<InputStreamResource> download(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id) {
        FileDownload download = gateway.download(gateway.authenticate(jwt), id);
        StoredFile sf = download.getFile();

        ResponseEntity<InputStreamResource> response;
        try {
            response = ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(sf.getContentType()))
                    .contentLength(sf.getSize())
                    .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                            .filename(sf.getFilename(), StandardCharsets.UTF_8)
                            .build()
                            .toString())
                    .body(new InputStreamResource(download.getContent()));
        } catch (RuntimeException e) {
            closeQuietly(download.getContent(), e);
            throw e;
        }
        return response;
    }

    private static void closeQuietly(InputStream in, RuntimeException failure) {
        try {
            in.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    @DeleteMapping("/files/{id}")
    public ResponseEntity<Void> delete(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id) {
        gateway.delete(gateway.authenticate(jwt), id);
        return ResponseEntity.noContent().build();
    }
}
