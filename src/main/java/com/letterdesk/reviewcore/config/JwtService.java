package com.letterdesk.reviewcore.config;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Instant;
import java.util.*;

@Component
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    private final Key key;
    private final long ttlSeconds;

    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.ttl-seconds:3600}") long ttlSeconds) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttlSeconds = ttlSeconds;
        log.info("JWT service initialized with TTL: {} seconds", ttlSeconds);
    }

    /* ------------------------ token creation ------------------------ */

    /** Subject is the user id; the email rides along for display and logs. */
    public String generateToken(UUID userId, String email, Set<String> roles) {
        Instant now = Instant.now();

        log.debug("Generating JWT token for user: {} ({}), roles: {}", userId, email, roles);
        return Jwts.builder()
                .setSubject(userId.toString())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                .claim("email", email)
                .claim("roles", roles == null ? List.of() : new ArrayList<>(roles))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /* ------------------------ token parsing ------------------------ */

    public Jws<Claims> parse(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token);
    }

    public Optional<UUID> getUserId(String token) {
        try {
            return Optional.ofNullable(parse(token).getBody().getSubject()).map(UUID::fromString);
        } catch (Exception e) {
            log.warn("Failed to extract subject from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Set<String> getRoles(String token) {
        try {
            Object rolesObj = parse(token).getBody().get("roles");
            if (rolesObj instanceof Collection<?> col) {
                Set<String> roles = new HashSet<>();
                for (Object o : col) {
                    roles.add(String.valueOf(o));
                }
                return roles;
            }
            log.debug("No roles found in token");
            return Set.of();
        } catch (Exception e) {
            log.warn("Failed to extract roles from token: {}", e.getMessage());
            return Set.of();
        }
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }
}
