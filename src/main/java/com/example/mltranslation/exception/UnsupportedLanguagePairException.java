package com.example.mltranslation.exception;

/**
 * 不支援的語言組合
 */
public class UnsupportedLanguagePairException extends BusinessRuleException {

    private final String sourceLang;
    private final String targetLang;

    public UnsupportedLanguagePairException(String sourceLang, String targetLang) {
        super(String.format("Unsupported language pair: %s -> %s", sourceLang, targetLang));
        this.sourceLang = sourceLang;
        this.targetLang = targetLang;
    }

    public String getSourceLang() {
        return sourceLang;
    }

    public String getTargetLang() {
        return targetLang;
    }
}
