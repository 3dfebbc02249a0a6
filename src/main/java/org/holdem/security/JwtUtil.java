package org.holdem.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.Key;
import java.util.Base64;
import java.util.Date;

/**
 * Verifies the HS256 tokens issued by the account service. The subject is the
 * player id used everywhere at the tables.
 */
@Component
public class JwtUtil {

    private Key key;

    @Value("${jwt.secret:}")
    private String jwtSecretBase64;

    @Value("${jwt.expiration-ms:86400000}")
    private long jwtExpirationMs;

    public JwtUtil() {
    }

    /** For tests and tools that mint their own tokens. */
    public JwtUtil(String secretBase64, long expirationMs) {
        this.jwtSecretBase64 = secretBase64;
        this.jwtExpirationMs = expirationMs;
        init();
    }

    @PostConstruct
    public void init() {
        if (jwtSecretBase64 == null || jwtSecretBase64.isBlank()) {
            throw new IllegalStateException("jwt.secret must be set (base64).");
        }
        this.key = Keys.hmacShaKeyFor(Base64.getDecoder().decode(jwtSecretBase64));
    }

    public String generateToken(String playerId) {
        Date now = new Date();
        return Jwts.builder()
                .setSubject(playerId)
                .setIssuedAt(now)
                .setExpiration(new Date(now.getTime() + jwtExpirationMs))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public String extractSubject(String token) {
        return parse(token).getBody().getSubject();
    }

    public boolean validateToken(String token) {
        try {
            String sub = parse(token).getBody().getSubject();
            return sub != null && !sub.isBlank();
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }

    private Jws<Claims> parse(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token);
    }
}
