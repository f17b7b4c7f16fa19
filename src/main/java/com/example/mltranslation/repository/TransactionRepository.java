package com.example.mltranslation.repository;

import com.example.mltranslation.entity.Transaction;
import com.example.mltranslation.entity.TransactionType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * TransactionRepository
 *
 * 功能：帳本查詢，一律由新到舊（created_at DESC, id DESC，同一時間戳以 id 排序）
 */
@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {

    /**
     * 查詢使用者的帳本紀錄
     *
     * @param userId   使用者 ID
     * @param pageable offset / limit（見 OffsetPageRequest）
     */
    List<Transaction> findByUserIdOrderByCreatedAtDescIdDesc(Long userId, Pageable pageable);

    /**
     * 管理員查詢，參數為 null 時不套用該條件
     */
    @Query("SELECT t FROM Transaction t "
         + "WHERE (:userId IS NULL OR t.userId = :userId) "
         + "AND (CAST(:from AS LocalDateTime) IS NULL OR t.createdAt >= :from) "
         + "AND (CAST(:to AS LocalDateTime) IS NULL OR t.createdAt <= :to) "
         + "ORDER BY t.createdAt DESC, t.id DESC")
    List<Transaction> search(@Param("userId") Long userId,
                             @Param("from") LocalDateTime from,
                             @Param("to") LocalDateTime to,
                             Pageable pageable);

    long countByUserId(Long userId);

    long countByUserIdAndType(Long userId, TransactionType type);
}
