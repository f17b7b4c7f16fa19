package com.example.mltranslation.security;

import com.example.mltranslation.config.JwtProperties;
import com.example.mltranslation.entity.User;
import com.example.mltranslation.repository.UserRepository;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.util.Date;
import java.util.Optional;

/**
 * JWT 簽發與驗證（HS256）
 *
 * - subject: 使用者 ID
 * - 驗證時重新讀取使用者，已刪除的帳號或權限變更立即生效
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtTokenService {

    private static final String TYPE_CLAIM = "type";
    private static final String ACCESS_TOKEN_TYPE = "access";

    private final JwtProperties properties;
    private final UserRepository userRepository;

    private SecretKey key;

    @PostConstruct
    public void init() {
        byte[] keyBytes = Decoders.BASE64.decode(properties.getSecret());
        this.key = Keys.hmacShaKeyFor(keyBytes);
    }

    public String generateAccessToken(User user) {
        Date now = new Date();
        Date expiry = new Date(now.getTime() + properties.getAccessTokenValidity().toMillis());

        return Jwts.builder()
                .subject(String.valueOf(user.getId()))
                .issuedAt(now)
                .expiration(expiry)
                .claim(TYPE_CLAIM, ACCESS_TOKEN_TYPE)
                .signWith(key)
                .compact();
    }

    public long getAccessTokenValiditySeconds() {
        return properties.getAccessTokenValidity().toSeconds();
    }

    /**
     * 解析 token 並建立 Authentication
     *
     * @return token 無效、過期或使用者不存在時為 empty
     */
    public Optional<Authentication> authenticate(String token) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException ex) {
            log.debug("JWT token is expired: {}", ex.getMessage());
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException ex) {
            log.warn("Invalid JWT token: {}", ex.getMessage());
            return Optional.empty();
        }

        if (!ACCESS_TOKEN_TYPE.equals(claims.get(TYPE_CLAIM, String.class))) {
            log.warn("JWT token is not an access token: subject={}", claims.getSubject());
            return Optional.empty();
        }

        Long userId;
        try {
            userId = Long.valueOf(claims.getSubject());
        } catch (NumberFormatException ex) {
            log.warn("JWT token has a malformed subject: {}", claims.getSubject());
            return Optional.empty();
        }

        return userRepository.findById(userId)
                .map(AuthenticatedUser::of)
                .map(principal -> new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities()));
    }
}
