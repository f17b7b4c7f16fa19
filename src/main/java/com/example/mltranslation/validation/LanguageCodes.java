package com.example.mltranslation.validation;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 語言代碼工具
 *
 * 語言代碼一律以小寫儲存與比較，格式為 2~3 個 ASCII 字母（ISO 639-1 / 639-2）。
 */
public final class LanguageCodes {

    private static final Pattern FORMAT = Pattern.compile("[a-z]{2,3}");

    private LanguageCodes() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 去除前後空白並轉為小寫；null 視為空字串
     */
    public static String normalize(String languageCode) {
        return languageCode == null ? "" : languageCode.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 正規化後是否為合法格式
     */
    public static boolean isWellFormed(String languageCode) {
        return FORMAT.matcher(normalize(languageCode)).matches();
    }
}
