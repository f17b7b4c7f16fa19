package com.example.mltranslation.facade.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Register Request DTO
 *
 * 密碼強度規則由 UserService 檢查，此處僅做基本格式驗證
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {
    @NotBlank(message = "Email cannot be null or blank")
    @Email(message = "Email must be a well-formed email address")
    @Size(max = 255, message = "Email must be at most 255 characters")
    private String email;

    @NotBlank(message = "Password cannot be null or blank")
    @Size(min = 8, max = 72, message = "Password length must be between 8 and 72 characters")
    private String password;
}
