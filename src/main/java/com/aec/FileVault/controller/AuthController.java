package com.aec.FileVault.controller;

import com.aec.FileVault.dto.LoginRequest;
import com.aec.FileVault.dto.LoginResponse;
import com.aec.FileVault.dto.UserDto;
import com.aec.FileVault.service.FileGatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
public class AuthController {

    private final FileGatewayService gateway;

    @PostMapping("/login")
    public LoginResponse login(@Valid @RequestBody LoginRequest request) {
        return gateway.login(request.getIdentityAssertion());
    }

    @GetMapping("/me")
    public UserDto me(@AuthenticationPrincipal Jwt jwt) {
        return UserDto.from(gateway.authenticate(jwt));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@AuthenticationPrincipal Jwt jwt) {
        gateway.logout(jwt);
        return ResponseEntity.noContent().build();
    }
}
