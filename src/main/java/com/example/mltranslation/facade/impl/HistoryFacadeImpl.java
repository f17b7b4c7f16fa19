package com.example.mltranslation.facade.impl;

import com.example.mltranslation.facade.HistoryFacade;
import com.example.mltranslation.facade.dto.HistoryResponse;
import com.example.mltranslation.facade.dto.TransactionItemDto;
import com.example.mltranslation.facade.dto.TranslationItemDto;
import com.example.mltranslation.service.HistoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class HistoryFacadeImpl implements HistoryFacade {

    private final HistoryService historyService;

    @Override
    public HistoryResponse<TranslationItemDto> getTranslations(Long userId, int offset, int limit) {
        List<TranslationItemDto> items = historyService.listTranslations(userId, offset, limit).stream()
                .map(HistoryItemMapper::toDto)
                .toList();
        long total = historyService.countTranslations(userId);
        log.info("Translation history retrieved: userId={}, offset={}, limit={}, returned={}, total={}",
                userId, offset, limit, items.size(), total);

        return HistoryResponse.<TranslationItemDto>builder()
                .items(items)
                .pagination(HistoryItemMapper.pagination(offset, limit, total))
                .build();
    }

    @Override
    public HistoryResponse<TransactionItemDto> getTransactions(Long userId, int offset, int limit) {
        List<TransactionItemDto> items = historyService.listTransactions(userId, offset, limit).stream()
                .map(HistoryItemMapper::toDto)
                .toList();
        long total = historyService.countTransactions(userId);
        log.info("Transaction history retrieved: userId={}, offset={}, limit={}, returned={}, total={}",
                userId, offset, limit, items.size(), total);

        return HistoryResponse.<TransactionItemDto>builder()
                .items(items)
                .pagination(HistoryItemMapper.pagination(offset, limit, total))
                .build();
    }
}
