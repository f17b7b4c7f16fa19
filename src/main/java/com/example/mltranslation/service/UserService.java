package com.example.mltranslation.service;

import com.example.mltranslation.entity.User;

/**
 * UserService 介面
 *
 * 功能：帳號註冊、登入驗證、管理員帳號初始化
 */
public interface UserService {

    /**
     * 註冊使用者並建立餘額為 0 的錢包（同一交易）
     *
     * 業務規則：
     * 1. email 去除空白並轉小寫後必須唯一
     * 2. 密碼至少 8 字元，需含大寫、小寫、數字，不可含空白
     *
     * @throws com.example.mltranslation.exception.RegistrationRejectedException email 或密碼不符規則
     * @throws com.example.mltranslation.exception.UserAlreadyExistsException email 已註冊
     */
    User register(String email, String password);

    /**
     * 驗證帳號密碼
     *
     * @throws com.example.mltranslation.exception.InvalidCredentialsException 帳號不存在或密碼錯誤
     */
    User authenticate(String email, String password);

    /**
     * @throws com.example.mltranslation.exception.UserNotFoundException 使用者不存在
     */
    User getUser(Long userId);

    /**
     * 確保管理員帳號存在；已存在時僅補上管理員權限
     */
    User ensureAdmin(String email, String password);
}
