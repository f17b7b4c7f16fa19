package com.example.mltranslation.facade;

import com.example.mltranslation.facade.dto.BalanceResponse;
import com.example.mltranslation.facade.dto.TopUpRequest;

/**
 * Wallet Facade
 *
 * 職責：
 * 1. 查詢登入者餘額（錢包不存在時建立）
 * 2. 登入者自行加值
 * 3. 鎖等待逾時轉換為 WalletLockTimeoutException
 */
public interface WalletFacade {

    BalanceResponse getBalance(Long userId);

    /**
     * @throws com.example.mltranslation.exception.InvalidAmountException amount <= 0
     * @throws com.example.mltranslation.exception.WalletLockTimeoutException 錢包鎖等待逾時
     */
    BalanceResponse topUp(Long userId, TopUpRequest request);
}
