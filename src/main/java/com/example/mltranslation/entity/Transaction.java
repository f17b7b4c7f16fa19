package com.example.mltranslation.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.SourceType;

import java.time.LocalDateTime;

/**
 * Transaction 實體（帳本表）
 *
 * 功能：每一次餘額變動都寫入一筆，只新增不修改
 * - amount 恆為正數，加減方向由 type 決定
 * - created_at 取資料庫時間，API 與 worker 寫入的紀錄排序一致
 * - 僅隨使用者刪除而串聯刪除
 */
@Entity
@Immutable
@Table(name = "transactions",
       indexes = @Index(name = "ix_transactions_user_time", columnList = "user_id, created_at"))
@Check(name = "ck_transactions_amount_positive", constraints = "amount > 0")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Getter(AccessLevel.NONE)
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", insertable = false, updatable = false,
                foreignKey = @ForeignKey(name = "fk_transactions_user"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @Column(nullable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionType type;

    @CreationTimestamp(source = SourceType.DB)
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static Transaction topUp(Long userId, long amount) {
        return Transaction.builder()
            .userId(userId)
            .amount(amount)
            .type(TransactionType.TOPUP)
            .build();
    }

    public static Transaction debit(Long userId, long amount) {
        return Transaction.builder()
            .userId(userId)
            .amount(amount)
            .type(TransactionType.DEBIT)
            .build();
    }
}
