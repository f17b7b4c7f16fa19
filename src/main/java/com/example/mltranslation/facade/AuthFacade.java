package com.example.mltranslation.facade;

import com.example.mltranslation.facade.dto.LoginRequest;
import com.example.mltranslation.facade.dto.ProfileResponse;
import com.example.mltranslation.facade.dto.RegisterRequest;
import com.example.mltranslation.facade.dto.RegisterResponse;
import com.example.mltranslation.facade.dto.TokenResponse;

/**
 * Auth Facade
 *
 * 職責：
 * 1. 註冊（委派 UserService，回傳使用者與初始餘額）
 * 2. 登入（驗證帳密後簽發 JWT）
 * 3. 查詢目前登入者資料
 */
public interface AuthFacade {

    /**
     * @throws com.example.mltranslation.exception.RegistrationRejectedException email 或密碼不符規則
     * @throws com.example.mltranslation.exception.UserAlreadyExistsException email 已註冊
     */
    RegisterResponse register(RegisterRequest request);

    /**
     * @throws com.example.mltranslation.exception.InvalidCredentialsException 帳號或密碼錯誤
     */
    TokenResponse login(LoginRequest request);

    ProfileResponse getProfile(Long userId);
}
