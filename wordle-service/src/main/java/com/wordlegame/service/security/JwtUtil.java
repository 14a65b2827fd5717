package com.wordlegame.service.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Validates bearer tokens issued by the account service and reads the player id from them.
 */
@Slf4j
@Component
public class JwtUtil {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey secretKey;

    public JwtUtil(@Value("${jwt.secret}") String secret) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Extract the player id from a token. Accepts a {@code user_id} or an {@code id} claim,
     * numeric or string.
     *
     * @throws JwtException if the token is invalid or expired
     */
    public String extractUserId(String token) {
        Claims claims = Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();

        Object userIdObj = claims.get("user_id");
        if (userIdObj == null) {
            userIdObj = claims.get("id");
        }
        if (userIdObj instanceof Number) {
            return String.valueOf(((Number) userIdObj).longValue());
        } else if (userIdObj instanceof String && !((String) userIdObj).isBlank()) {
            return (String) userIdObj;
        }

        throw new JwtException("Token carries no user id claim");
    }

    /**
     * Player id from an {@code Authorization} header, or empty for guests and unusable tokens.
     */
    public Optional<String> resolveUserId(String authHeader) {
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        try {
            return Optional.of(extractUserId(authHeader.substring(BEARER_PREFIX.length()).trim()));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Ignoring unusable bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Like {@link #resolveUserId(String)} but for endpoints that need a signed-in player.
     *
     * @throws UnauthorizedException if the header is missing or the token is invalid
     */
    public String requireUserId(String authHeader) {
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            throw new UnauthorizedException("Missing bearer token");
        }
        try {
            return extractUserId(authHeader.substring(BEARER_PREFIX.length()).trim());
        } catch (JwtException | IllegalArgumentException e) {
            throw new UnauthorizedException("Invalid token", e);
        }
    }
}
