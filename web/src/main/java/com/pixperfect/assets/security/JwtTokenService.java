package com.pixperfect.assets.security;

import com.pixperfect.assets.common.model.Account;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

@Slf4j
@Component
public class JwtTokenService {

    private static final String USERNAME_CLAIM = "username";

    private final Key key;
    private final Duration expiration;

    public JwtTokenService(@Value("${assets.jwt.secret}") String secret,
                           @Value("${assets.jwt.expiration:24h}") Duration expiration) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalStateException("assets.jwt.secret must be at least 32 bytes");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiration = expiration;
    }

    public String issueToken(Account account) {
        Instant now = Instant.now();
        return Jwts.builder()
                .setSubject(String.valueOf(account.getId()))
                .claim(USERNAME_CLAIM, account.getUsername())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(expiration)))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * @return the owner id carried by the token, empty when the token is invalid or expired
     */
    public Optional<Long> resolveOwnerId(String token) {
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            return Optional.of(Long.valueOf(claims.getSubject()));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
