package com.example.mltranslation.exception;

/**
 * 使用者已存在異常
 *
 * 使用場景：
 * 1. 註冊前檢查 email 已被使用
 * 2. 並發註冊被唯一鍵 uk_users_email 擋下（不向外拋出資料庫例外）
 */
public class UserAlreadyExistsException extends BusinessRuleException {

    private final String email;

    public UserAlreadyExistsException(String email) {
        super(String.format("User with this email already exists: %s", email));
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
