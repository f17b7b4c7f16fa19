package com.example.mltranslation.security;

import com.example.mltranslation.entity.User;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.io.Serializable;
import java.util.List;

/**
 * 已驗證使用者（SecurityContext principal）
 *
 * 由 JwtAuthenticationFilter 建立，controller 以 @AuthenticationPrincipal 取得。
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class AuthenticatedUser implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String ROLE_USER = "ROLE_USER";
    public static final String ROLE_ADMIN = "ROLE_ADMIN";

    private final Long id;
    private final String email;
    private final boolean admin;

    public static AuthenticatedUser of(User user) {
        return new AuthenticatedUser(user.getId(), user.getEmail(), user.isAdmin());
    }

    public List<GrantedAuthority> getAuthorities() {
        if (admin) {
            return List.of(new SimpleGrantedAuthority(ROLE_USER), new SimpleGrantedAuthority(ROLE_ADMIN));
        }
        return List.of(new SimpleGrantedAuthority(ROLE_USER));
    }
}
