package com.example.mltranslation.facade.dto;

import com.example.mltranslation.validation.LanguageCode;
import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Translate Request DTO
 *
 * 同步翻譯與非同步任務共用
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranslateRequest {
    /**
     * 原文
     * 要求：去除空白後非空
     */
    @NotBlank(message = "Input text cannot be null or blank")
    @Size(max = 5000, message = "Input text must be at most 5000 characters")
    @JsonAlias({"input_text", "text"})
    private String inputText;

    @NotBlank(message = "Source language cannot be null or blank")
    @LanguageCode
    @JsonAlias("source_lang")
    private String sourceLang;

    @NotBlank(message = "Target language cannot be null or blank")
    @LanguageCode
    @JsonAlias("target_lang")
    private String targetLang;
}
