package com.example.mltranslation.facade.impl;

import com.example.mltranslation.entity.User;
import com.example.mltranslation.exception.UserAlreadyExistsException;
import com.example.mltranslation.facade.AuthFacade;
import com.example.mltranslation.facade.dto.LoginRequest;
import com.example.mltranslation.facade.dto.ProfileResponse;
import com.example.mltranslation.facade.dto.RegisterRequest;
import com.example.mltranslation.facade.dto.RegisterResponse;
import com.example.mltranslation.facade.dto.TokenResponse;
import com.example.mltranslation.security.JwtTokenService;
import com.example.mltranslation.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class AuthFacadeImpl implements AuthFacade {

    private static final String TOKEN_TYPE = "Bearer";

    private final UserService userService;
    private final JwtTokenService jwtTokenService;

    @Override
    public RegisterResponse register(RegisterRequest request) {
        try {
            log.info("Processing register request: email={}", request.getEmail());

            User user = userService.register(request.getEmail(), request.getPassword());

            return RegisterResponse.builder()
                    .userId(user.getId())
                    .email(user.getEmail())
                    .balance(0L)
                    .createdAt(user.getCreatedAt())
                    .build();

        } catch (UserAlreadyExistsException e) {
            log.warn("Registration rejected, email already registered: {}", e.getEmail());
            throw e;
        }
    }

    @Override
    public TokenResponse login(LoginRequest request) {
        User user = userService.authenticate(request.getEmail(), request.getPassword());
        String token = jwtTokenService.generateAccessToken(user);
        log.info("User logged in: userId={}", user.getId());

        return TokenResponse.builder()
                .accessToken(token)
                .tokenType(TOKEN_TYPE)
                .expiresIn(jwtTokenService.getAccessTokenValiditySeconds())
                .build();
    }

    @Override
    public ProfileResponse getProfile(Long userId) {
        User user = userService.getUser(userId);
        return ProfileResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .admin(user.isAdmin())
                .build();
    }
}
