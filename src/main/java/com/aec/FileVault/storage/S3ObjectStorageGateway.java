package com.aec.FileVault.storage;

import com.aec.FileVault.config.StorageProperties;
import com.aec.FileVault.exception.ErrorKind;
import com.aec.FileVault.exception.FileVaultException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.InputStream;

/** S3-compatible backend (AWS S3, Cloudflare R2, MinIO). */
@Slf4j
@Service
@RequiredArgsConstructor
public class S3ObjectStorageGateway implements ObjectStorageGateway {

    private final S3Client s3;
    private final StorageProperties props;

    @Override
    public void put(String key, InputStream content, long size, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(props.getBucket())
                .key(key)
                .contentType(contentType)
                .contentLength(size)
                .build();
        try {
            s3.putObject(request, RequestBody.fromInputStream(content, size));
            log.debug("S3.put OK -> bucket={}, key={}, size={}", props.getBucket(), key, size);
        } catch (SdkException e) {
            log.warn("S3.put ERROR bucket={}, key={}: {}", props.getBucket(), key, e.getMessage());
            throw new FileVaultException(ErrorKind.STORAGE_FAILURE, "Failed to write object " + key, e);
        }
    }

    @Override
    public InputStream get(String key) {
        try {
            return s3.getObject(GetObjectRequest.builder()
                    .bucket(props.getBucket())
                    .key(key)
                    .build());
        } catch (NoSuchKeyException e) {
            log.error("S3.get missing blob bucket={}, key={}", props.getBucket(), key);
            throw new FileVaultException(ErrorKind.NOT_FOUND, "Object not found: " + key, e);
        } catch (SdkException e) {
            log.warn("S3.get ERROR bucket={}, key={}: {}", props.getBucket(), key, e.getMessage());
            throw new FileVaultException(ErrorKind.STORAGE_FAILURE, "Failed to read object " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            s3.deleteObject(DeleteObjectRequest.builder()
                    .bucket(props.getBucket())
                    .key(key)
                    .build());
            log.debug("S3.delete OK -> bucket={}, key={}", props.getBucket(), key);
        } catch (SdkException e) {
            log.warn("S3.delete ERROR bucket={}, key={}: {}", props.getBucket(), key, e.getMessage());
            throw new FileVaultException(ErrorKind.STORAGE_FAILURE, "Failed to delete object " + key, e);
        }
    }
}
