package com.example.mltranslation.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.SourceType;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * Wallet 實體（錢包表）
 *
 * 功能：記錄每個使用者的額度餘額，user_id 同時為主鍵與 users 外鍵（一人一個錢包）
 * 不變量：balance >= 0（WalletService 檢查 + 資料庫 CHECK）
 * 並發控制：只在悲觀鎖（WalletRepository.findByUserIdForUpdate）下修改
 * 實作 Persistable 介面：version 為 null 時視為新實體，走 INSERT 而非 merge
 */
@Entity
@Table(name = "wallets")
@Check(name = "ck_wallets_balance_non_negative", constraints = "balance >= 0")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Wallet implements Persistable<Long> {

    @Id
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", insertable = false, updatable = false,
                foreignKey = @ForeignKey(name = "fk_wallets_user"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    /**
     * 額度餘額（整數點數）
     */
    @Column(nullable = false)
    private long balance;

    @CreationTimestamp(source = SourceType.DB)
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Version
    private Long version;

    @Override
    public Long getId() {
        return userId;
    }

    @Override
    @Transient
    public boolean isNew() {
        return version == null;
    }
}
