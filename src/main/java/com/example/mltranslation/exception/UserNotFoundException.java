package com.example.mltranslation.exception;

/**
 * 使用者不存在異常
 *
 * 使用場景：
 * 1. WalletService.lockForUpdate() 查無使用者
 * 2. 佇列任務的使用者已被刪除
 * 3. 管理員核發額度給不存在的使用者
 */
public class UserNotFoundException extends BusinessRuleException {

    private final Long userId;

    public UserNotFoundException(Long userId) {
        super(String.format("User not found: %d", userId));
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }
}
