package com.aec.FileVault.config;

import com.aec.FileVault.dto.ErrorResponse;
import com.aec.FileVault.exception.ErrorKind;
import com.aec.FileVault.exception.FileVaultException;
import com.aec.FileVault.service.SessionTokenService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

@Slf4j
@Configuration
public class SecurityConfig {

    /** Bearer tokens are our own session tokens, validated by SessionTokenService. */
    @Bean
    public JwtDecoder jwtDecoder(SessionTokenService sessions) {
        return token -> {
            try {
                return sessions.decode(token);
            } catch (FileVaultException e) {
                throw new BadJwtException(e.getMessage(), e);
            }
        };
    }

    @Bean
    SecurityFilterChain filterChain(HttpSecurity http, JwtDecoder jwtDecoder,
                                    AuthenticationEntryPoint entryPoint,
                                    CorsConfigurationSource corsConfigurationSource) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .cors(cors -> cors.configurationSource(corsConfigurationSource))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.POST, "/login").permitAll()
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers("/error").permitAll()
                .requestMatchers("/actuator/health").permitAll()
                .anyRequest().authenticated()
            )
            .oauth2ResourceServer(oauth2 -> oauth2
                .jwt(jwt -> jwt.decoder(jwtDecoder))
                .authenticationEntryPoint(entryPoint)
            )
            .exceptionHandling(ex -> ex.authenticationEntryPoint(entryPoint))
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS));
        return http.build();
    }

    /**
     * 401 for missing, invalid, expired or revoked tokens (expired_token kept distinct so the
     * client can say "session ended"), 503 when the revocation store cannot be read.
     */
    @Bean
    public AuthenticationEntryPoint customAuthenticationEntryPoint(ObjectMapper objectMapper) {
        return (request, response, authException) -> {
            ErrorKind kind = ErrorKind.UNAUTHORIZED;
            String message = "Authentication required";
            for (Throwable t = authException; t != null; t = t.getCause()) {
                if (t instanceof FileVaultException) {
                    kind = ((FileVaultException) t).getKind();
                    message = t.getMessage();
                    break;
                }
            }
            log.debug("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), kind);
            response.setStatus(kind.status().value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), ErrorResponse.builder()
                    .error(kind.code())
                    .message(message)
                    .path(request.getRequestURI())
                    .build());
        };
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource(CorsProperties props) {
        CorsConfiguration cfg = new CorsConfiguration();
        cfg.setAllowedOrigins(props.getAllowedOrigins());
        cfg.setAllowedMethods(List.of("GET", "POST", "DELETE", "OPTIONS"));
        cfg.setAllowedHeaders(List.of("*"));
        cfg.setExposedHeaders(List.of("Content-Disposition"));
        cfg.setMaxAge(3600L);
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", cfg);
        return source;
    }
}
