package com.example.mltranslation.facade.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranslateResponse {
    private String externalId;
    private String inputText;
    private String outputText;
    private String sourceLang;
    private String targetLang;

    /**
     * 扣除額度；未扣款時為 null（不輸出）
     */
    private Integer cost;
    private LocalDateTime createdAt;
}
