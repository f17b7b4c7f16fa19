package com.example.mltranslation.service;

/**
 * 餘額不足時的處理策略
 *
 * 依入口（同步 HTTP / 佇列任務）於啟動時從設定讀取：
 * - translation.policy.sync
 * - translation.policy.queued
 * 不會依單一請求切換。
 */
public enum InsufficientFundsPolicy {

    /**
     * 拒絕請求（InsufficientFundsException），不翻譯、不寫入任何紀錄
     */
    STRICT,

    /**
     * 照常翻譯，Translation 以 cost = null 記錄；不扣款、不寫帳本
     */
    LENIENT
}
