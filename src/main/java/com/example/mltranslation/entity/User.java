package com.example.mltranslation.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.SourceType;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * User 實體（使用者表）
 *
 * - email 正規化（去空白、小寫）後儲存，唯一
 * - 只保存密碼雜湊
 * - 錢包、帳本、翻譯紀錄皆以 ON DELETE CASCADE 參照 users.id
 */
@Entity
@Table(name = "users",
       uniqueConstraints = @UniqueConstraint(name = "uk_users_email", columnNames = "email"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 正規化後的 email，只能透過 {@link #changeEmail(String)} 修改
     */
    @Setter(AccessLevel.NONE)
    @Column(nullable = false, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(nullable = false)
    private boolean admin;

    /**
     * 建立時間（資料庫時間）
     */
    @CreationTimestamp(source = SourceType.DB)
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public void changeEmail(String email) {
        this.email = normalizeEmail(email);
    }

    public static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * builder 設定 email 時同樣正規化
     */
    public static class UserBuilder {
        public UserBuilder email(String email) {
            this.email = normalizeEmail(email);
            return this;
        }
    }
}
