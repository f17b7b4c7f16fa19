package com.example.mltranslation.exception;

/**
 * 佇列任務缺少必要欄位
 */
public class MalformedTaskException extends BusinessRuleException {

    public MalformedTaskException(String message) {
        super(message);
    }
}
