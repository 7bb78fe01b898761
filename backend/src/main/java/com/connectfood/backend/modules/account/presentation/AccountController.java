package com.connectfood.backend.modules.account.presentation;

import com.connectfood.backend.modules.account.application.AccountService;
import com.connectfood.backend.modules.account.presentation.dto.LoginRequest;
import com.connectfood.backend.modules.account.presentation.dto.LoginResponse;
import com.connectfood.backend.modules.account.presentation.dto.RegisterRequest;
import com.connectfood.backend.modules.account.presentation.dto.RegisterResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    @Operation(summary = "Register a donor or recipient account")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Account created"),
            @ApiResponse(responseCode = "400", description = "Email already registered – code `EMAIL_ALREADY_REGISTERED`"),
            @ApiResponse(responseCode = "422", description = "Invalid field values")
    })
    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.ok(accountService.register(request));
    }

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(accountService.login(request));
    }
}
