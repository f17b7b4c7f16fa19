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
 * Translation 實體（翻譯紀錄表）
 *
 * 冪等：
 * - external_id 為佇列任務 ID，同步請求則為產生的 UUID；非 null 時唯一
 * - 重送的任務以 external_id 查到既有紀錄，直接回傳結果，不重複扣款
 *
 * cost: 本筆扣除的額度；LENIENT 模式免費翻譯時為 null
 */
@Entity
@Immutable
@Table(name = "translations",
       uniqueConstraints = @UniqueConstraint(name = "uk_translations_external_id", columnNames = "external_id"),
       indexes = @Index(name = "ix_translations_user_time", columnList = "user_id, created_at"))
@Check(name = "ck_translations_cost_positive", constraints = "cost IS NULL OR cost > 0")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Translation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Getter(AccessLevel.NONE)
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", insertable = false, updatable = false,
                foreignKey = @ForeignKey(name = "fk_translations_user"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @Column(name = "external_id", length = 64)
    private String externalId;

    @Lob
    @Column(name = "input_text", nullable = false)
    private String inputText;

    @Lob
    @Column(name = "output_text", nullable = false)
    private String outputText;

    @Column(name = "source_lang", nullable = false, length = 8)
    private String sourceLang;

    @Column(name = "target_lang", nullable = false, length = 8)
    private String targetLang;

    @Column
    private Integer cost;

    @CreationTimestamp(source = SourceType.DB)
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean isCharged() {
        return cost != null;
    }
}
