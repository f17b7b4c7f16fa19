package com.example.mltranslation.repository;

import com.example.mltranslation.entity.Translation;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * TranslationRepository
 *
 * 自訂查詢方法：
 * 1. findByExternalId - 冪等檢查
 * 2. findByExternalIdAndUserId - 查詢任務狀態（限本人）
 * 3. 歷史紀錄 / 管理員查詢，由新到舊
 */
@Repository
public interface TranslationRepository extends JpaRepository<Translation, Long> {

    /**
     * 冪等檢查
     *
     * 查到紀錄表示該請求已完成（已翻譯、已扣款、已記錄），呼叫端應直接回傳既有結果。
     * 由唯一鍵 uk_translations_external_id 保證
     *
     * @param externalId 佇列任務 ID 或同步請求產生的 ID
     */
    Optional<Translation> findByExternalId(String externalId);

    Optional<Translation> findByExternalIdAndUserId(String externalId, Long userId);

    List<Translation> findByUserIdOrderByCreatedAtDescIdDesc(Long userId, Pageable pageable);

    @Query("SELECT t FROM Translation t "
         + "WHERE (:userId IS NULL OR t.userId = :userId) "
         + "AND (CAST(:from AS LocalDateTime) IS NULL OR t.createdAt >= :from) "
         + "AND (CAST(:to AS LocalDateTime) IS NULL OR t.createdAt <= :to) "
         + "ORDER BY t.createdAt DESC, t.id DESC")
    List<Translation> search(@Param("userId") Long userId,
                             @Param("from") LocalDateTime from,
                             @Param("to") LocalDateTime to,
                             Pageable pageable);

    long countByUserId(Long userId);
}
