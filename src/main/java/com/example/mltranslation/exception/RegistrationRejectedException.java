package com.example.mltranslation.exception;

/**
 * 註冊時 email 格式或密碼強度不符
 */
public class RegistrationRejectedException extends BusinessRuleException {

    public RegistrationRejectedException(String message) {
        super(message);
    }
}
