package com.example.mltranslation.facade;

import com.example.mltranslation.facade.dto.HistoryResponse;
import com.example.mltranslation.facade.dto.TransactionItemDto;
import com.example.mltranslation.facade.dto.TranslationItemDto;

/**
 * History Facade
 *
 * 登入者自己的翻譯紀錄與帳本，由新到舊，offset / limit 分頁
 */
public interface HistoryFacade {

    HistoryResponse<TranslationItemDto> getTranslations(Long userId, int offset, int limit);

    HistoryResponse<TransactionItemDto> getTransactions(Long userId, int offset, int limit);
}
