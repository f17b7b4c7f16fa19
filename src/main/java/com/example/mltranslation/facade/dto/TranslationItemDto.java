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
public class TranslationItemDto {
    private Long id;
    private String externalId;
    private String inputText;
    private String outputText;
    private String sourceLang;
    private String targetLang;
    private Integer cost;
    private LocalDateTime createdAt;
}
