package com.example.mltranslation.service.impl;

import com.example.mltranslation.entity.User;
import com.example.mltranslation.exception.InvalidCredentialsException;
import com.example.mltranslation.exception.RegistrationRejectedException;
import com.example.mltranslation.exception.UserAlreadyExistsException;
import com.example.mltranslation.exception.UserNotFoundException;
import com.example.mltranslation.repository.UserRepository;
import com.example.mltranslation.service.UserService;
import com.example.mltranslation.service.WalletService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * UserService 實作類別
 *
 * 實作重點：
 * 1. 密碼僅保存 BCrypt 雜湊
 * 2. 重複註冊：先以 existsByEmail 檢查，併發時由唯一鍵 uk_users_email 攔截
 * 3. 登入失敗不區分「帳號不存在」與「密碼錯誤」
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,}$");
    private static final int PASSWORD_MIN_LENGTH = 8;

    private final UserRepository userRepository;
    private final WalletService walletService;
    private final PasswordEncoder passwordEncoder;

    @Override
    @Transactional
    public User register(String email, String password) {
        String normalizedEmail = User.normalizeEmail(email);
        validateEmail(normalizedEmail);
        validatePassword(password);

        if (userRepository.existsByEmail(normalizedEmail)) {
            throw new UserAlreadyExistsException(normalizedEmail);
        }

        User user = User.builder()
            .email(normalizedEmail)
            .passwordHash(passwordEncoder.encode(password))
            .admin(false)
            .build();
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // 併發註冊同一 email
            throw new UserAlreadyExistsException(normalizedEmail);
        }

        walletService.getOrCreate(user.getId());
        log.info("User registered: userId={}, email={}", user.getId(), normalizedEmail);
        return user;
    }

    @Override
    @Transactional(readOnly = true)
    public User authenticate(String email, String password) {
        Optional<User> user = userRepository.findByEmail(User.normalizeEmail(email));
        if (user.isEmpty() || password == null || !passwordEncoder.matches(password, user.get().getPasswordHash())) {
            log.warn("Login failed: email={}", User.normalizeEmail(email));
            throw new InvalidCredentialsException();
        }
        return user.get();
    }

    @Override
    @Transactional(readOnly = true)
    public User getUser(Long userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> new UserNotFoundException(userId));
    }

    @Override
    @Transactional
    public User ensureAdmin(String email, String password) {
        String normalizedEmail = User.normalizeEmail(email);
        Optional<User> existing = userRepository.findByEmail(normalizedEmail);
        if (existing.isPresent()) {
            User user = existing.get();
            if (!user.isAdmin()) {
                user.setAdmin(true);
                userRepository.save(user);
                log.info("Granted admin role: userId={}, email={}", user.getId(), normalizedEmail);
            }
            return user;
        }

        User admin = register(normalizedEmail, password);
        admin.setAdmin(true);
        userRepository.save(admin);
        log.info("Admin account created: userId={}, email={}", admin.getId(), normalizedEmail);
        return admin;
    }

    private static void validateEmail(String email) {
        if (email.isEmpty()) {
            throw new RegistrationRejectedException("Email is required");
        }
        if (!EMAIL.matcher(email).matches()) {
            throw new RegistrationRejectedException("Malformed email: " + email);
        }
    }

    private static void validatePassword(String password) {
        if (password == null || password.length() < PASSWORD_MIN_LENGTH) {
            throw new RegistrationRejectedException("Password must be at least " + PASSWORD_MIN_LENGTH + " characters");
        }
        if (password.chars().anyMatch(Character::isWhitespace)) {
            throw new RegistrationRejectedException("Password must not contain whitespace");
        }
        if (password.chars().noneMatch(Character::isUpperCase)) {
            throw new RegistrationRejectedException("Password must contain an uppercase letter");
        }
        if (password.chars().noneMatch(Character::isLowerCase)) {
            throw new RegistrationRejectedException("Password must contain a lowercase letter");
        }
        if (password.chars().noneMatch(Character::isDigit)) {
            throw new RegistrationRejectedException("Password must contain a digit");
        }
    }
}
