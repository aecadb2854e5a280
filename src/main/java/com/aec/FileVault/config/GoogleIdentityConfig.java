package com.aec.FileVault.config;

import com.google.api.client.googleapis.auth.oauth2.GoogleIdTokenVerifier;
import com.google.api.client.googleapis.auth.oauth2.GooglePublicKeysManager;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.jackson2.JacksonFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.security.GeneralSecurityException;

@Slf4j
@Configuration
public class GoogleIdentityConfig {

    @Bean
    public NetHttpTransport googleHttpTransport() throws GeneralSecurityException, IOException {
        return GoogleNetHttpTransport.newTrustedTransport();
    }

    /** Caches Google's signing certificates for as long as their Cache-Control allows. */
    @Bean
    public GooglePublicKeysManager googlePublicKeysManager(NetHttpTransport googleHttpTransport) {
        return new GooglePublicKeysManager.Builder(googleHttpTransport, JacksonFactory.getDefaultInstance())
            .build();
    }

    @Bean
    public GoogleIdTokenVerifier googleIdTokenVerifier(GooglePublicKeysManager keys, GoogleIdentityProperties props) {
        if (props.getClientIds().isEmpty()) {
            log.warn("filevault.identity.client-ids is empty; every Google ID token will fail the audience check");
        }
        return new GoogleIdTokenVerifier.Builder(keys)
            .setAudience(props.getClientIds())
            .build();
    }
}
