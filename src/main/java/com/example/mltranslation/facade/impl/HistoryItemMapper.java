package com.example.mltranslation.facade.impl;

import com.example.mltranslation.entity.Transaction;
import com.example.mltranslation.entity.Translation;
import com.example.mltranslation.facade.dto.PaginationMeta;
import com.example.mltranslation.facade.dto.TransactionItemDto;
import com.example.mltranslation.facade.dto.TranslationItemDto;

/**
 * 歷史紀錄實體 → DTO
 */
final class HistoryItemMapper {

    private HistoryItemMapper() {
        throw new UnsupportedOperationException("Utility class");
    }

    static TranslationItemDto toDto(Translation translation) {
        return TranslationItemDto.builder()
                .id(translation.getId())
                .externalId(translation.getExternalId())
                .inputText(translation.getInputText())
                .outputText(translation.getOutputText())
                .sourceLang(translation.getSourceLang())
                .targetLang(translation.getTargetLang())
                .cost(translation.getCost())
                .createdAt(translation.getCreatedAt())
                .build();
    }

    static TransactionItemDto toDto(Transaction transaction) {
        return TransactionItemDto.builder()
                .id(transaction.getId())
                .userId(transaction.getUserId())
                .amount(transaction.getAmount())
                .type(transaction.getType())
                .createdAt(transaction.getCreatedAt())
                .build();
    }

    static PaginationMeta pagination(int offset, int limit, long totalElements) {
        return PaginationMeta.builder()
                .offset(offset)
                .limit(limit)
                .totalElements(totalElements)
                .hasNext((long) offset + limit < totalElements)
                .hasPrevious(offset > 0)
                .build();
    }
}
