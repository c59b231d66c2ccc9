package com.pixperfect.assets.security;

import com.pixperfect.assets.common.model.Account;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-secret-that-is-long-enough-0123456789";

    private JwtTokenService tokenService;

    @BeforeEach
    void setUp() {
        tokenService = new JwtTokenService(SECRET, Duration.ofHours(1));
    }

    @Test
    void issuedTokenResolvesToAccountId() {
        String token = tokenService.issueToken(account(42L, "alice"));

        assertEquals(42L, tokenService.resolveOwnerId(token).orElseThrow());
    }

    @Test
    void garbageTokenIsRejected() {
        assertTrue(tokenService.resolveOwnerId("not-a-jwt").isEmpty());
        assertTrue(tokenService.resolveOwnerId("").isEmpty());
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService other = new JwtTokenService("another-secret-that-is-long-enough-9876543210", Duration.ofHours(1));
        String token = other.issueToken(account(42L, "alice"));

        assertTrue(tokenService.resolveOwnerId(token).isEmpty());
    }

    @Test
    void expiredTokenIsRejected() {
        String token = Jwts.builder()
                .setSubject("42")
                .setIssuedAt(new Date(System.currentTimeMillis() - 120_000))
                .setExpiration(new Date(System.currentTimeMillis() - 60_000))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();

        assertTrue(tokenService.resolveOwnerId(token).isEmpty());
    }

    @Test
    void shortSecretIsRefused() {
        assertThrows(IllegalStateException.class, () -> new JwtTokenService("too-short", Duration.ofHours(1)));
    }

    private static Account account(Long id, String username) {
        Account account = new Account(username, "hash");
        account.setId(id);
        return account;
    }
}
