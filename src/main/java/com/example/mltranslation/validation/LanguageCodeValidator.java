package com.example.mltranslation.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class LanguageCodeValidator implements ConstraintValidator<LanguageCode, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        // Null values are handled by @NotBlank
        if (value == null) {
            return true;
        }
        return LanguageCodes.isWellFormed(value);
    }
}
