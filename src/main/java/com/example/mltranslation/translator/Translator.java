package com.example.mltranslation.translator;

/**
 * 翻譯器介面
 *
 * 實作可能很慢、可能失敗，呼叫端需假設兩者皆會發生。
 */
public interface Translator {

    /**
     * 翻譯文字
     *
     * @param text 原文（已去除前後空白、非空）
     * @param sourceLang 來源語言（小寫語言代碼）
     * @param targetLang 目標語言（小寫語言代碼）
     * @return 譯文
     * @throws com.example.mltranslation.exception.UnsupportedLanguagePairException 不支援的語言組合
     * @throws com.example.mltranslation.exception.TranslationFailedException 翻譯失敗或逾時
     */
    String translate(String text, String sourceLang, String targetLang);
}
