package com.chatdesk.auth;

import com.chatdesk.config.AuthProperties;
import com.chatdesk.user.repository.UserRepository;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Validates HS256 access tokens issued by the account service and resolves the user
 * behind them. The user id is read from the {@code userId} claim, falling back to the subject.
 */
@Slf4j
@Component
public class JwtCredentialValidator implements CredentialValidator {

    private final SecretKey key;
    private final UserRepository userRepository;

    public JwtCredentialValidator(AuthProperties authProperties, UserRepository userRepository) {
        this.key = Keys.hmacShaKeyFor(authProperties.getJwtSecret().getBytes(StandardCharsets.UTF_8));
        this.userRepository = userRepository;
    }

    @Override
    public AuthenticatedPrincipal validate(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new InvalidCredentialException("Token required");
        }

        UUID userId = extractUserId(parseClaims(credential));

        return userRepository.findActiveInActiveTenant(userId)
                .map(user -> new AuthenticatedPrincipal(
                        user.getId(), user.getTenantId(), user.getUserRole(),
                        user.getFirstName(), user.getLastName()))
                .orElseThrow(() -> new InvalidCredentialException("User not found or inactive"));
    }

    private Claims parseClaims(String token) {
        try {
            return Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected realtime token: {}", e.getMessage());
            throw new InvalidCredentialException("Authentication failed", e);
        }
    }

    private UUID extractUserId(Claims claims) {
        String userId = claims.get("userId", String.class);
        if (userId == null) {
            userId = claims.getSubject();
        }
        if (userId == null) {
            throw new InvalidCredentialException("Token has no user id");
        }
        try {
            return UUID.fromString(userId);
        } catch (IllegalArgumentException e) {
            throw new InvalidCredentialException("Token has a malformed user id", e);
        }
    }
}
