package com.example.mltranslation.service;

import com.example.mltranslation.entity.Transaction;
import com.example.mltranslation.entity.Translation;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * HistoryService 介面
 *
 * 功能：翻譯紀錄與帳本的唯讀查詢，一律由新到舊排序（created_at DESC, id DESC）
 */
public interface HistoryService {

    List<Translation> listTranslations(Long userId, int offset, int limit);

    List<Transaction> listTransactions(Long userId, int offset, int limit);

    long countTranslations(Long userId);

    long countTransactions(Long userId);

    /**
     * 依任務 ID 查詢翻譯結果，僅限任務擁有者
     *
     * @return 尚未完成（或不屬於該使用者）時為 empty
     */
    Optional<Translation> findTaskResult(String taskId, Long userId);

    /**
     * 管理員查詢帳本；userId / from / to 為 null 時不套用該條件
     */
    List<Transaction> searchTransactions(Long userId, LocalDateTime from, LocalDateTime to, int offset, int limit);

    /**
     * 管理員查詢翻譯紀錄；userId / from / to 為 null 時不套用該條件
     */
    List<Translation> searchTranslations(Long userId, LocalDateTime from, LocalDateTime to, int offset, int limit);
}
