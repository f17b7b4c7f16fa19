package com.example.mltranslation.service;

import com.example.mltranslation.entity.Wallet;

/**
 * WalletService 介面
 *
 * 功能：管理使用者錢包（額度餘額）
 *
 * 職責：
 * 1. 錢包延遲建立（首次存取時建立，餘額 0）
 * 2. 錢包鎖定（悲觀鎖，SELECT ... FOR UPDATE）
 * 3. 加值 / 扣款（僅限已鎖定的錢包）
 * 4. 餘額查詢（含快取）
 *
 * 設計原則：
 * - lockForUpdate / credit / debit 必須在呼叫端的交易內執行（Propagation.MANDATORY）
 * - 帳本紀錄（Transaction）由呼叫端在同一交易內寫入
 * - 餘額變更後發布 WalletBalanceChangedEvent，交易提交後清除快取
 */
public interface WalletService {

    /**
     * 取得使用者錢包，不存在時建立（餘額 0）
     *
     * 同一使用者併發首次存取時只會建立一個錢包。
     *
     * @param userId 使用者 ID
     * @return 錢包（未鎖定）
     * @throws com.example.mltranslation.exception.UserNotFoundException 使用者不存在
     */
    Wallet getOrCreate(Long userId);

    /**
     * 鎖定使用者錢包（不存在時先建立）
     *
     * 鎖定持續到呼叫端交易結束（commit 或 rollback）。
     * 鎖等待逾時或死結以 PessimisticLockingFailureException 拋出。
     *
     * @param userId 使用者 ID
     * @return 已鎖定的錢包
     * @throws com.example.mltranslation.exception.UserNotFoundException 使用者不存在
     */
    Wallet lockForUpdate(Long userId);

    /**
     * 增加已鎖定錢包的餘額
     *
     * @param wallet 由 lockForUpdate 取得的錢包
     * @param amount 金額（> 0）
     * @return 變更後餘額
     * @throws com.example.mltranslation.exception.InvalidAmountException amount <= 0
     */
    long credit(Wallet wallet, long amount);

    /**
     * 扣減已鎖定錢包的餘額
     *
     * @param wallet 由 lockForUpdate 取得的錢包
     * @param amount 金額（> 0）
     * @return 變更後餘額
     * @throws com.example.mltranslation.exception.InvalidAmountException amount <= 0
     * @throws com.example.mltranslation.exception.InsufficientFundsException 餘額不足
     */
    long debit(Wallet wallet, long amount);

    /**
     * 查詢使用者餘額
     *
     * 查詢策略：
     * 1. 優先從 Redis 快取讀取（key = userId）
     * 2. 快取未命中時查詢資料庫（錢包不存在則建立）
     *
     * @param userId 使用者 ID
     * @return 當前餘額
     * @throws com.example.mltranslation.exception.UserNotFoundException 使用者不存在
     */
    long getBalance(Long userId);

    void evictBalanceCache(Long userId);
}
