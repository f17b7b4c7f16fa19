package com.example.mltranslation.facade;

import com.example.mltranslation.facade.dto.AdminTopUpRequest;
import com.example.mltranslation.facade.dto.BalanceResponse;
import com.example.mltranslation.facade.dto.TransactionItemDto;
import com.example.mltranslation.facade.dto.TranslationItemDto;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Admin Facade
 *
 * 職責：
 * 1. 核發額度給指定使用者（CreditService.approveBonus）
 * 2. 跨使用者查詢帳本與翻譯紀錄（可依使用者與時間區間篩選）
 */
public interface AdminFacade {

    /**
     * @throws com.example.mltranslation.exception.InvalidAmountException amount <= 0
     * @throws com.example.mltranslation.exception.UserNotFoundException 使用者不存在
     * @throws com.example.mltranslation.exception.WalletLockTimeoutException 錢包鎖等待逾時
     */
    BalanceResponse approveBonus(Long adminId, AdminTopUpRequest request);

    List<TransactionItemDto> searchTransactions(Long userId, LocalDateTime from, LocalDateTime to, int offset, int limit);

    List<TranslationItemDto> searchTranslations(Long userId, LocalDateTime from, LocalDateTime to, int offset, int limit);
}
