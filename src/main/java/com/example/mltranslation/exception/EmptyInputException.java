package com.example.mltranslation.exception;

/**
 * 輸入文字為 null 或去除空白後為空
 */
public class EmptyInputException extends BusinessRuleException {

    public EmptyInputException() {
        super("Input text is empty");
    }
}
