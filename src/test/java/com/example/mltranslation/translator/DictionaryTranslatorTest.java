package com.example.mltranslation.translator;

import com.example.mltranslation.exception.UnsupportedLanguagePairException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DictionaryTranslator Unit Tests")
class DictionaryTranslatorTest {

    private final DictionaryTranslator translator = new DictionaryTranslator();

    @Test
    @DisplayName("translate - en -> fr - Replaces known words and keeps punctuation and capitalisation")
    void translate_EnToFr_ReplacesKnownWords() {
        assertThat(translator.translate("Hello, world!", "en", "fr")).isEqualTo("Bonjour, monde!");
    }

    @Test
    @DisplayName("translate - fr -> en - Uses the inverted dictionary")
    void translate_FrToEn_UsesInvertedDictionary() {
        assertThat(translator.translate("merci mon ami", "fr", "en")).isEqualTo("thanks mon friend");
    }

    @Test
    @DisplayName("translate - With no known word - Returns target-tagged original text")
    void translate_WithNoKnownWord_ReturnsTaggedOriginal() {
        assertThat(translator.translate("Zebra crossing", "en", "fr")).isEqualTo("[fr] Zebra crossing");
    }

    @Test
    @DisplayName("translate - With unsupported pair - Throws UnsupportedLanguagePairException")
    void translate_WithUnsupportedPair_Throws() {
        assertThatThrownBy(() -> translator.translate("hello", "en", "de"))
            .isInstanceOf(UnsupportedLanguagePairException.class)
            .hasMessageContaining("en -> de");
    }
}
