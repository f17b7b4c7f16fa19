package com.example.mltranslation.service;

import lombok.Builder;
import lombok.Value;

/**
 * 單筆翻譯請求（來自 HTTP 或佇列任務）
 *
 * 欄位為原始輸入，由 TranslationRequestProcessor 負責正規化與驗證。
 */
@Value
@Builder
public class TranslationCommand {

    Long userId;

    String inputText;

    String sourceLang;

    String targetLang;

    /**
     * 冪等鍵（佇列任務 ID）；同步請求為 null
     */
    String externalId;
}
