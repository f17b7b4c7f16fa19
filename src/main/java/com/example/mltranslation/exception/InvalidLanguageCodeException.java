package com.example.mltranslation.exception;

public class InvalidLanguageCodeException extends BusinessRuleException {

    private final String languageCode;

    public InvalidLanguageCodeException(String languageCode) {
        super(String.format("Malformed language code: '%s'", languageCode));
        this.languageCode = languageCode;
    }

    public String getLanguageCode() {
        return languageCode;
    }
}
