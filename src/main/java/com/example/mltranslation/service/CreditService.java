package com.example.mltranslation.service;

/**
 * CreditService 介面
 *
 * 功能：增加使用者額度（管理員核發 / 使用者自行加值）
 *
 * 兩者皆為單一工作單元：鎖定錢包 → 加值 → 寫入 TOPUP 帳本紀錄。
 * 失敗時整筆 rollback，餘額與帳本不會只變更其一。
 */
public interface CreditService {

    /**
     * 單次加值上限
     */
    long MAX_AMOUNT = 1_000_000_000L;

    /**
     * 管理員核發額度
     *
     * @param userId 使用者 ID
     * @param amount 金額（> 0）
     * @return 變更後餘額
     * @throws com.example.mltranslation.exception.InvalidAmountException amount <= 0 或超過 MAX_AMOUNT（不會鎖定錢包）
     * @throws com.example.mltranslation.exception.UserNotFoundException 使用者不存在
     */
    long approveBonus(Long userId, long amount);

    /**
     * 使用者自行加值
     *
     * @param userId 使用者 ID
     * @param amount 金額（> 0）
     * @return 變更後餘額
     * @throws com.example.mltranslation.exception.InvalidAmountException amount <= 0
     * @throws com.example.mltranslation.exception.UserNotFoundException 使用者不存在
     */
    long topUp(Long userId, long amount);
}
