package com.example.mltranslation.controller;

import com.example.mltranslation.config.SecurityConfig;
import com.example.mltranslation.exception.InvalidCredentialsException;
import com.example.mltranslation.exception.RegistrationRejectedException;
import com.example.mltranslation.exception.UserAlreadyExistsException;
import com.example.mltranslation.facade.AuthFacade;
import com.example.mltranslation.facade.dto.LoginRequest;
import com.example.mltranslation.facade.dto.ProfileResponse;
import com.example.mltranslation.facade.dto.RegisterRequest;
import com.example.mltranslation.facade.dto.RegisterResponse;
import com.example.mltranslation.facade.dto.TokenResponse;
import com.example.mltranslation.security.AuthenticatedUser;
import com.example.mltranslation.security.JwtTokenService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {AuthController.class})
@AutoConfigureMockMvc
@Import(SecurityConfig.class)
@DisplayName("AuthController Tests")
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AuthFacade authFacade;

    @MockitoBean
    private JwtTokenService jwtTokenService;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("register - With valid request - Returns 201 with zero balance")
    void register_WithValidRequest_Returns201() throws Exception {
        when(authFacade.register(any(RegisterRequest.class)))
            .thenReturn(RegisterResponse.builder()
                .userId(1L)
                .email("alice@example.com")
                .balance(0L)
                .createdAt(LocalDateTime.now())
                .build());

        mockMvc.perform(post("/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RegisterRequest("alice@example.com", "Secret123"))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.userId").value(1))
            .andExpect(jsonPath("$.balance").value(0));
    }

    @Test
    @DisplayName("register - With malformed email - Returns 400 Validation Failed")
    void register_WithMalformedEmail_Returns400() throws Exception {
        mockMvc.perform(post("/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RegisterRequest("not-an-email", "Secret123"))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.message").value(containsString("email")));

        verifyNoInteractions(authFacade);
    }

    @Test
    @DisplayName("register - With weak password - Returns 400 Invalid Request")
    void register_WithWeakPassword_Returns400() throws Exception {
        when(authFacade.register(any()))
            .thenThrow(new RegistrationRejectedException("Password must contain a digit"));

        mockMvc.perform(post("/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RegisterRequest("alice@example.com", "NoDigitsHere"))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid Request"))
            .andExpect(jsonPath("$.message").value("Password must contain a digit"));
    }

    @Test
    @DisplayName("register - With existing email - Returns 409")
    void register_WithExistingEmail_Returns409() throws Exception {
        when(authFacade.register(any())).thenThrow(new UserAlreadyExistsException("alice@example.com"));

        mockMvc.perform(post("/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RegisterRequest("alice@example.com", "Secret123"))))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.path").value("/auth/register"));
    }

    @Test
    @DisplayName("login - With valid credentials - Returns bearer token")
    void login_WithValidCredentials_ReturnsToken() throws Exception {
        when(authFacade.login(any(LoginRequest.class)))
            .thenReturn(TokenResponse.builder().accessToken("jwt").tokenType("Bearer").expiresIn(3600).build());

        mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new LoginRequest("alice@example.com", "Secret123"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.accessToken").value("jwt"))
            .andExpect(jsonPath("$.tokenType").value("Bearer"));
    }

    @Test
    @DisplayName("login - With wrong password - Returns 401")
    void login_WithWrongPassword_Returns401() throws Exception {
        when(authFacade.login(any())).thenThrow(new InvalidCredentialsException());

        mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new LoginRequest("alice@example.com", "Wrong1234"))))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Unauthorized"));
    }

    @Test
    @DisplayName("me - With bearer token - Authenticates through JWT filter")
    void me_WithBearerToken_AuthenticatesThroughFilter() throws Exception {
        // Given
        AuthenticatedUser principal = new AuthenticatedUser(3L, "carol@example.com", false);
        when(jwtTokenService.authenticate("valid-token"))
            .thenReturn(Optional.of(new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities())));
        when(authFacade.getProfile(3L))
            .thenReturn(ProfileResponse.builder().id(3L).email("carol@example.com").admin(false).build());

        // When & Then
        mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer valid-token"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(3))
            .andExpect(jsonPath("$.admin").value(false));
    }

    @Test
    @DisplayName("me - With rejected token - Returns 401")
    void me_WithRejectedToken_Returns401() throws Exception {
        when(jwtTokenService.authenticate("bad-token")).thenReturn(Optional.empty());

        mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer bad-token"))
            .andExpect(status().isUnauthorized());

        verifyNoInteractions(authFacade);
    }
}
