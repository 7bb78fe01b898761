package com.connectfood.backend.modules.account.application;

import java.util.Locale;

import com.connectfood.backend.global.error.ProblemException;
import com.connectfood.backend.modules.account.domain.Account;
import com.connectfood.backend.modules.account.domain.AccountRole;
import com.connectfood.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.connectfood.backend.modules.account.presentation.dto.AccountProfileResponse;
import com.connectfood.backend.modules.account.presentation.dto.LoginRequest;
import com.connectfood.backend.modules.account.presentation.dto.LoginResponse;
import com.connectfood.backend.modules.account.presentation.dto.RegisterRequest;
import com.connectfood.backend.modules.account.presentation.dto.RegisterResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Prototype registration and credential check. No tokens or sessions are issued.
 */
@Service
@Transactional
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;

    public AccountService(AccountRepository accountRepository, PasswordEncoder passwordEncoder) {
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
    }

    public RegisterResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.email());
        if (accountRepository.existsByEmailIgnoreCase(email)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "EMAIL_ALREADY_REGISTERED", "Email already registered");
        }
        AccountRole role = AccountRole.fromCode(request.role())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_ROLE",
                        "role must be donor or recipient"));

        Account account = new Account();
        account.setName(request.name().trim());
        account.setEmail(email);
        account.setPasswordHash(passwordEncoder.encode(request.password()));
        account.setRole(role);
        account.setPhone(trimToNull(request.phone()));
        account.setLatitude(request.lat());
        account.setLongitude(request.lng());
        account.setPreferredCategory(trimToNull(request.preferredCategory()));
        account.setActive(true);

        Account saved = accountRepository.save(account);
        log.info("Registered {} account {}", role.code(), saved.getId());
        return new RegisterResponse(saved.getId(), saved.getEmail(), role.code());
    }

    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        Account account = accountRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid credentials"));

        if (!passwordEncoder.matches(request.password(), account.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid credentials");
        }

        return new LoginResponse(new AccountProfileResponse(
                account.getId(),
                account.getName(),
                account.getEmail(),
                account.getRole().code(),
                account.getLatitude(),
                account.getLongitude()
        ));
    }

    private static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
