package com.aec.FileVault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "filevault.storage")
public class StorageProperties {
    /** e.g. https://<account>.r2.cloudflarestorage.com; empty means AWS itself */
    private String endpoint;
    private String region = "auto";
    private String bucket;
    private String accessKeyId;
    private String secretAccessKey;
    private boolean pathStyleAccess = false;
}
