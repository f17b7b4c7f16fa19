package com.example.mltranslation.service;

import java.util.Optional;

/**
 * 翻譯請求處理器
 *
 * 一筆翻譯請求 = 一個工作單元：
 * 正規化 → 冪等檢查 → 鎖定錢包 → 鎖內再次冪等檢查 → 餘額檢查 → 翻譯 → 扣款 + 帳本 + 翻譯紀錄
 *
 * 保證：
 * - 同一使用者的「檢查餘額 → 扣款」由錢包列鎖序列化，餘額永不為負
 * - 任一步驟失敗整筆 rollback：不扣款、不寫帳本、不寫翻譯紀錄
 * - 同一 external_id 至多扣款一次，重送時回傳既有結果（replayed = true）
 * - 每筆扣款都有一筆對應的 DEBIT 帳本紀錄與 cost 相同的翻譯紀錄
 */
public interface TranslationRequestProcessor {

    /**
     * 處理翻譯請求
     *
     * @param command 請求內容
     * @param policy 餘額不足時的處理策略
     * @return 處理結果（新建或重放）
     * @throws com.example.mltranslation.exception.EmptyInputException 原文為空白
     * @throws com.example.mltranslation.exception.InvalidLanguageCodeException 語言代碼格式錯誤
     * @throws com.example.mltranslation.exception.UserNotFoundException 使用者不存在
     * @throws com.example.mltranslation.exception.InsufficientFundsException STRICT 且餘額不足
     * @throws com.example.mltranslation.exception.ExternalIdConflictException external_id 屬於其他使用者
     * @throws com.example.mltranslation.exception.UnsupportedLanguagePairException 不支援的語言組合
     * @throws com.example.mltranslation.exception.TranslationFailedException 翻譯失敗或逾時
     */
    TranslationOutcome process(TranslationCommand command, InsufficientFundsPolicy policy);

    /**
     * 依 external_id 讀取既有結果（唯一鍵衝突後的重放）
     */
    Optional<TranslationOutcome> findCompleted(String externalId, Long userId);
}
