package com.example.mltranslation.exception;

/**
 * 餘額不足異常
 *
 * 使用場景：
 * 1. WalletService.debit() 餘額小於扣款金額
 * 2. TranslationRequestProcessor 在 STRICT 模式下，呼叫翻譯前檢查
 */
public class InsufficientFundsException extends BusinessRuleException {

    private final Long userId;
    private final long currentBalance;
    private final long requiredAmount;

    public InsufficientFundsException(Long userId, long currentBalance, long requiredAmount) {
        super(String.format("Insufficient funds for user: %d (current: %d, required: %d)",
            userId, currentBalance, requiredAmount));
        this.userId = userId;
        this.currentBalance = currentBalance;
        this.requiredAmount = requiredAmount;
    }

    public Long getUserId() {
        return userId;
    }

    public long getCurrentBalance() {
        return currentBalance;
    }

    public long getRequiredAmount() {
        return requiredAmount;
    }
}
