package com.pixperfect.assets.controller;

import com.pixperfect.assets.model.CredentialsRequest;
import com.pixperfect.assets.model.MessageResponse;
import com.pixperfect.assets.model.TokenResponse;
import com.pixperfect.assets.service.AccountService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AuthController {

    private final AccountService accountService;

    @GetMapping("/")
    public String status() {
        return "PixPerfect Backend is running!";
    }

    @PostMapping("/signup")
    public MessageResponse signup(@Valid @RequestBody CredentialsRequest request) {
        accountService.signup(request.getUsername(), request.getPassword());
        return new MessageResponse("User created successfully");
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody CredentialsRequest request) {
        return new TokenResponse(accountService.login(request.getUsername(), request.getPassword()));
    }
}
