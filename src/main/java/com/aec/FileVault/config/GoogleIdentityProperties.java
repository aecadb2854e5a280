package com.aec.FileVault.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "filevault.identity")
public class GoogleIdentityProperties {
    /** OAuth client ids accepted as the ID token audience */
    private List<String> clientIds = new ArrayList<>();

    public List<String> getClientIds() { return clientIds; }
    public void setClientIds(List<String> clientIds) { this.clientIds = clientIds; }
}
