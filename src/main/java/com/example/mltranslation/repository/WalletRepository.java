package com.example.mltranslation.repository;

import com.example.mltranslation.entity.Wallet;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * WalletRepository
 *
 * 自訂查詢方法：
 * 1. findByUserIdForUpdate - 悲觀鎖定查詢（SELECT ... FOR UPDATE）
 * 2. insertIfAbsent - 首次存取時建立錢包，並發安全
 * 3. findLedgerMismatches - 餘額與帳本對帳
 */
@Repository
public interface WalletRepository extends JpaRepository<Wallet, Long> {

    /**
     * 使用悲觀鎖定查詢錢包（FOR UPDATE），鎖持有至交易結束
     *
     * 用途：同一使用者的「檢查餘額 → 扣款」在所有 API 與 worker 實例間序列化
     * 鎖等待逾時或死結時拋出 PessimisticLockingFailureException
     *
     * @param userId 使用者 ID
     * @return 已鎖定的錢包，不存在時為 empty
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Wallet w WHERE w.userId = :userId")
    Optional<Wallet> findByUserIdForUpdate(@Param("userId") Long userId);

    /**
     * 建立餘額為 0 的錢包（已存在則不動）
     *
     * 兩個交易同時首次存取時都會成功，後到者在主鍵衝突時變成 no-op
     *
     * @param userId 使用者 ID（須存在於 users）
     * @return MySQL 回報的影響列數（1 新增，0 已存在）
     */
    @Modifying
    @Query(value = "INSERT INTO wallets (user_id, balance, version, created_at) "
                 + "VALUES (:userId, 0, 0, CURRENT_TIMESTAMP(6)) "
                 + "ON DUPLICATE KEY UPDATE user_id = user_id",
           nativeQuery = true)
    int insertIfAbsent(@Param("userId") Long userId);

    /**
     * 餘額與帳本加總（TOPUP 加、DEBIT 減）不一致的錢包
     */
    @Query(value = "SELECT w.user_id AS userId, w.balance AS balance, "
                 + "COALESCE(SUM(CASE WHEN t.type = 'TOPUP' THEN t.amount ELSE -t.amount END), 0) AS ledgerBalance "
                 + "FROM wallets w LEFT JOIN transactions t ON t.user_id = w.user_id "
                 + "GROUP BY w.user_id, w.balance "
                 + "HAVING w.balance <> COALESCE(SUM(CASE WHEN t.type = 'TOPUP' THEN t.amount ELSE -t.amount END), 0)",
           nativeQuery = true)
    List<WalletLedgerMismatch> findLedgerMismatches();
}
