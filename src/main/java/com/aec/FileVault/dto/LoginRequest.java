package com.aec.FileVault.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class LoginRequest {
    // older clients post the Google credential as google_token
    @NotBlank
    @JsonAlias("google_token")
    private String identityAssertion;
}
