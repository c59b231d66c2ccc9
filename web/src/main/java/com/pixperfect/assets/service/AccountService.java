package com.pixperfect.assets.service;

import com.pixperfect.assets.common.exception.InvalidParameterException;
import com.pixperfect.assets.common.model.Account;
import com.pixperfect.assets.common.repository.AccountRepository;
import com.pixperfect.assets.security.JwtTokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Account signup and login. Issues the bearer tokens that resolve to an owner id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private static final String INVALID_CREDENTIALS = "Invalid credentials";

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public Account signup(String username, String password) {
        if (accountRepository.existsByUsername(username)) {
            throw new InvalidParameterException("Username already exists");
        }
        try {
            Account account = accountRepository.save(new Account(username, passwordEncoder.encode(password)));
            log.info("Account registered: id={}, username={}", account.getId(), account.getUsername());
            return account;
        } catch (DataIntegrityViolationException e) {
            // lost a race against a concurrent signup with the same name
            throw new InvalidParameterException("Username already exists", e);
        }
    }

    public String login(String username, String password) {
        Account account = accountRepository.findByUsername(username).orElse(null);
        if (account == null) {
            log.info("Login failed: unknown username {}", username);
            throw new InvalidParameterException(INVALID_CREDENTIALS);
        }
        if (!passwordEncoder.matches(password, account.getPasswordHash())) {
            log.info("Login failed: password mismatch for username {}", username);
            throw new InvalidParameterException(INVALID_CREDENTIALS);
        }
        log.info("Login successful for username {}", username);
        return jwtTokenService.issueToken(account);
    }
}
