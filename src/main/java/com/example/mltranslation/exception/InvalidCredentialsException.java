package com.example.mltranslation.exception;

public class InvalidCredentialsException extends BusinessRuleException {

    public InvalidCredentialsException() {
        super("Invalid credentials");
    }
}
