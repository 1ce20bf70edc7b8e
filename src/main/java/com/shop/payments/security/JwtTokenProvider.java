package com.shop.payments.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Issues and checks HMAC-signed bearer tokens. The subject is the user id; the {@code role}
 * claim is "user" or "admin".
 */
@Slf4j
@Component
public class JwtTokenProvider {

    static final String ROLE_CLAIM = "role";

    private final SecretKey key;
    private final long expiration;

    public JwtTokenProvider(
            @Value("${jwt.secret:shopPaymentsLocalDevelopmentSecretKeyThatIsLongEnough}") String secret,
            @Value("${jwt.expiration:3600000}") long expiration) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiration = expiration;
    }

    public String createToken(String userId, String role) {
        Date now = new Date();
        return Jwts.builder()
                .subject(userId)
                .claim(ROLE_CLAIM, role)
                .issuedAt(now)
                .expiration(new Date(now.getTime() + expiration))
                .signWith(key)
                .compact();
    }

    /**
     * Verifies the token and returns the user it was issued to.
     *
     * @throws JwtException if the token is expired, tampered with or malformed
     */
    public AuthenticatedUser parse(String token) {
        Claims claims = Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
        String role = claims.get(ROLE_CLAIM, String.class);
        return new AuthenticatedUser(claims.getSubject(), role != null ? role : AuthenticatedUser.ROLE_USER);
    }

    public boolean validateToken(String token) {
        try {
            Jwts.parser().verifyWith(key).build().parseSignedClaims(token);
            return true;
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid bearer token: {}", e.getMessage());
            return false;
        }
    }
}
