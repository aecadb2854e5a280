package com.aec.FileVault.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "filevault.session")
public class SessionProperties {
    /** Base64 HMAC-SHA256 key, 32 bytes or more once decoded */
    private String secret;
    private Duration ttl = Duration.ofHours(24);
    private String issuer = "file-vault";

    public String getSecret() { return secret; }
    public void setSecret(String secret) { this.secret = secret; }
    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }
    public String getIssuer() { return issuer; }
    public void setIssuer(String issuer) { this.issuer = issuer; }
}
