package com.example.mltranslation.translator;

import com.example.mltranslation.exception.TranslationFailedException;
import com.example.mltranslation.exception.UnsupportedLanguagePairException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * TimeLimitedTranslator 單元測試
 *
 * 使用真實執行緒池，驗證逾時取消與例外轉換。
 */
@DisplayName("TimeLimitedTranslator Unit Tests")
class TimeLimitedTranslatorTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("translate - Within timeout - Returns delegate result")
    void translate_WithinTimeout_ReturnsDelegateResult() {
        Translator translator = new TimeLimitedTranslator(
            (text, source, target) -> text.toUpperCase(), executor, Duration.ofSeconds(2));

        assertThat(translator.translate("abc", "en", "fr")).isEqualTo("ABC");
    }

    @Test
    @DisplayName("translate - Exceeding timeout - Throws timed-out TranslationFailedException and interrupts worker")
    void translate_ExceedingTimeout_ThrowsTimedOutAndInterrupts() throws InterruptedException {
        // Given
        CountDownLatch interrupted = new CountDownLatch(1);
        Translator slow = (text, source, target) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return text;
        };
        Translator translator = new TimeLimitedTranslator(slow, executor, Duration.ofMillis(100));

        // When & Then
        assertThatThrownBy(() -> translator.translate("abc", "en", "fr"))
            .isInstanceOf(TranslationFailedException.class)
            .satisfies(e -> assertThat(((TranslationFailedException) e).isTimedOut()).isTrue());

        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("translate - Delegate throws business error - Rethrows it unchanged")
    void translate_DelegateThrowsBusinessError_RethrowsUnchanged() {
        Translator translator = new TimeLimitedTranslator((text, source, target) -> {
            throw new UnsupportedLanguagePairException(source, target);
        }, executor, Duration.ofSeconds(2));

        assertThatThrownBy(() -> translator.translate("abc", "en", "de"))
            .isInstanceOf(UnsupportedLanguagePairException.class);
    }

    @Test
    @DisplayName("translate - Delegate throws runtime error - Wraps in TranslationFailedException")
    void translate_DelegateThrowsRuntimeError_Wraps() {
        Translator translator = new TimeLimitedTranslator((text, source, target) -> {
            throw new IllegalStateException("boom");
        }, executor, Duration.ofSeconds(2));

        assertThatThrownBy(() -> translator.translate("abc", "en", "fr"))
            .isInstanceOf(TranslationFailedException.class)
            .hasMessageContaining("boom")
            .hasCauseInstanceOf(IllegalStateException.class)
            .satisfies(e -> assertThat(((TranslationFailedException) e).isTimedOut()).isFalse());
    }

    @Test
    @DisplayName("translate - With shut down executor - Throws TranslationFailedException")
    void translate_WithShutDownExecutor_Throws() {
        executor.shutdown();
        Translator translator = new TimeLimitedTranslator((text, source, target) -> text, executor, Duration.ofSeconds(1));

        assertThatThrownBy(() -> translator.translate("abc", "en", "fr"))
            .isInstanceOf(TranslationFailedException.class);
    }
}
