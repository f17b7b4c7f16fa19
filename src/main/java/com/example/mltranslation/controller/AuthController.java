package com.example.mltranslation.controller;

import com.example.mltranslation.facade.AuthFacade;
import com.example.mltranslation.facade.dto.LoginRequest;
import com.example.mltranslation.facade.dto.ProfileResponse;
import com.example.mltranslation.facade.dto.RegisterRequest;
import com.example.mltranslation.facade.dto.RegisterResponse;
import com.example.mltranslation.facade.dto.TokenResponse;
import com.example.mltranslation.security.AuthenticatedUser;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthFacade authFacade;

    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        log.info("POST /auth/register - email={}", request.getEmail());

        RegisterResponse response = authFacade.register(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        log.info("POST /auth/login - email={}", request.getEmail());

        return ResponseEntity.ok(authFacade.login(request));
    }

    @GetMapping("/me")
    public ResponseEntity<ProfileResponse> me(@AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(authFacade.getProfile(user.getId()));
    }
}
