package com.example.mltranslation.service;

import com.example.mltranslation.entity.Translation;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 翻譯請求處理結果
 *
 * - cost 為 null 表示未扣款（LENIENT 策略）
 * - replayed 為 true 表示結果來自先前同一 external_id 的處理
 */
@Value
@Builder
public class TranslationOutcome {

    Long translationId;

    String externalId;

    String inputText;

    String outputText;

    String sourceLang;

    String targetLang;

    Integer cost;

    LocalDateTime createdAt;

    boolean replayed;

    public static TranslationOutcome of(Translation translation, boolean replayed) {
        return TranslationOutcome.builder()
            .translationId(translation.getId())
            .externalId(translation.getExternalId())
            .inputText(translation.getInputText())
            .outputText(translation.getOutputText())
            .sourceLang(translation.getSourceLang())
            .targetLang(translation.getTargetLang())
            .cost(translation.getCost())
            .createdAt(translation.getCreatedAt())
            .replayed(replayed)
            .build();
    }
}
