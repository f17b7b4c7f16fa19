package com.example.mltranslation.entity;

/**
 * 帳本紀錄類型
 *
 * - TOPUP: 加值（使用者自行加值或管理員核發）
 * - DEBIT: 翻譯扣款
 */
public enum TransactionType {

    TOPUP,

    DEBIT;

    /**
     * 帶正負號的餘額變動量
     */
    public long signed(long amount) {
        return this == TOPUP ? amount : -amount;
    }
}
