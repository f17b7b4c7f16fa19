package com.example.mltranslation.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/**
 * 語言代碼格式（2~3 個字母，不分大小寫）
 *
 * null 視為合法，必填請搭配 @NotBlank。
 */
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Constraint(validatedBy = LanguageCodeValidator.class)
@Documented
public @interface LanguageCode {

    String message() default "Language code must be 2-3 letters";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
