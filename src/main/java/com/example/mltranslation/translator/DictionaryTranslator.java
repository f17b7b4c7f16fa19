package com.example.mltranslation.translator;

import com.example.mltranslation.exception.UnsupportedLanguagePairException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 字典翻譯器（英文 / 法文）
 *
 * 以單字為單位查表替換，保留標點與首字母大寫。
 * 沒有任何單字可翻譯時回傳 "[目標語言] 原文"。
 */
public class DictionaryTranslator implements Translator {

    private static final Pattern WORD = Pattern.compile("\\p{L}+");

    private static final Map<String, String> EN_TO_FR = Map.ofEntries(
        Map.entry("hello", "bonjour"),
        Map.entry("world", "monde"),
        Map.entry("good", "bon"),
        Map.entry("morning", "matin"),
        Map.entry("evening", "soir"),
        Map.entry("night", "nuit"),
        Map.entry("thanks", "merci"),
        Map.entry("yes", "oui"),
        Map.entry("no", "non"),
        Map.entry("cat", "chat"),
        Map.entry("dog", "chien"),
        Map.entry("friend", "ami"),
        Map.entry("book", "livre"),
        Map.entry("water", "eau"),
        Map.entry("house", "maison")
    );

    private final Map<String, Map<String, String>> dictionaries = new HashMap<>();

    public DictionaryTranslator() {
        dictionaries.put(pairKey("en", "fr"), EN_TO_FR);
        dictionaries.put(pairKey("fr", "en"), invert(EN_TO_FR));
    }

    @Override
    public String translate(String text, String sourceLang, String targetLang) {
        Map<String, String> dictionary = dictionaries.get(pairKey(sourceLang, targetLang));
        if (dictionary == null) {
            throw new UnsupportedLanguagePairException(sourceLang, targetLang);
        }

        Matcher matcher = WORD.matcher(text);
        StringBuilder out = new StringBuilder();
        boolean translatedAny = false;
        while (matcher.find()) {
            String word = matcher.group();
            String translated = dictionary.get(word.toLowerCase(Locale.ROOT));
            if (translated != null) {
                translatedAny = true;
                word = Character.isUpperCase(word.charAt(0)) ? capitalize(translated) : translated;
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(word));
        }
        matcher.appendTail(out);

        if (!translatedAny) {
            return "[" + targetLang + "] " + text;
        }
        return out.toString();
    }

    private static String pairKey(String sourceLang, String targetLang) {
        return sourceLang + "->" + targetLang;
    }

    private static Map<String, String> invert(Map<String, String> dictionary) {
        Map<String, String> inverted = new HashMap<>();
        dictionary.forEach((key, value) -> inverted.put(value, key));
        return Map.copyOf(inverted);
    }

    private static String capitalize(String word) {
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
