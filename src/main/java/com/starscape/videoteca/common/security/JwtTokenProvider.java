package com.starscape.videoteca.common.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.List;

/**
 * Verifies HS256 bearer tokens issued by the auth service sharing our secret.
 * Token minting is only used by local tooling and tests.
 */
@Component
public class JwtTokenProvider {
    
    private final SecretKey secretKey;
    private final long expirationMs;
    private final String issuer;
    
    public JwtTokenProvider(
            @Value("${app.security.jwt.secret}") String secret,
            @Value("${app.security.jwt.expiration-ms}") long expirationMs,
            @Value("${app.security.jwt.issuer}") String issuer) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expirationMs = expirationMs;
        this.issuer = issuer;
    }
    
    public String generateToken(String userId, String email, List<String> scopes) {
        Instant now = Instant.now();
        Instant expiration = now.plusMillis(expirationMs);
        
        return Jwts.builder()
                .subject(userId)
                .claim("email", email)
                .claim("scopes", String.join(",", scopes))
                .issuer(issuer)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiration))
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();
    }
    
    public Claims validateToken(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .requireIssuer(issuer)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
    
    /**
     * @return the authenticated principal, or null if the token is invalid or expired
     */
    public UserPrincipal toPrincipal(String token) {
        try {
            Claims claims = validateToken(token);
            String scopesStr = claims.get("scopes", String.class);
            List<String> scopes = scopesStr != null && !scopesStr.isBlank()
                ? List.of(scopesStr.split(","))
                : List.of();
            return new UserPrincipal(claims.getSubject(), claims.get("email", String.class), scopes);
        } catch (JwtException | IllegalArgumentException e) {
            return null;
        }
    }
}
