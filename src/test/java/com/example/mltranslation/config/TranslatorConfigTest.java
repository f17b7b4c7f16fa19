package com.example.mltranslation.config;

import com.example.mltranslation.exception.TranslationFailedException;
import com.example.mltranslation.translator.Translator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * TranslatorConfig 單元測試
 *
 * 執行緒池必須有界：佇列滿時翻譯立即失敗，不無限排隊。
 */
@DisplayName("TranslatorConfig Unit Tests")
class TranslatorConfigTest {

    private final CountDownLatch release = new CountDownLatch(1);

    private ThreadPoolTaskExecutor executor;

    private TranslatorConfig config;

    @BeforeEach
    void setUp() {
        TranslationProperties properties = new TranslationProperties();
        properties.setTranslatorThreads(1);
        properties.setTranslatorQueueCapacity(1);
        properties.setTranslatorTimeout(Duration.ofSeconds(5));
        config = new TranslatorConfig(properties);
        executor = config.translatorExecutor();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdown();
    }

    @Test
    @DisplayName("translatorExecutor - Uses configured pool size and bounded queue")
    void translatorExecutor_UsesConfiguredPoolSizeAndBoundedQueue() {
        ThreadPoolExecutor pool = executor.getThreadPoolExecutor();

        assertThat(pool.getCorePoolSize()).isEqualTo(1);
        assertThat(pool.getMaximumPoolSize()).isEqualTo(1);
        assertThat(pool.getQueue().remainingCapacity()).isEqualTo(1);
        assertThat(pool.getRejectedExecutionHandler()).isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
    }

    @Test
    @DisplayName("translatorExecutor - When saturated - Rejects instead of queueing")
    void translatorExecutor_WhenSaturated_Rejects() throws InterruptedException {
        saturate();

        assertThatThrownBy(() -> executor.getThreadPoolExecutor().execute(() -> { }))
            .isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    @DisplayName("translator - When executor saturated - Fails fast with TranslationFailedException")
    void translator_WhenExecutorSaturated_FailsFast() throws InterruptedException {
        // Given
        saturate();
        Translator translator = config.translator(executor);

        // When & Then
        long started = System.nanoTime();
        assertThatThrownBy(() -> translator.translate("hello", "en", "fr"))
            .isInstanceOf(TranslationFailedException.class)
            .hasMessageContaining("not accepting work")
            .hasCauseInstanceOf(RejectedExecutionException.class)
            .satisfies(e -> assertThat(((TranslationFailedException) e).isTimedOut()).isFalse());
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
    }

    /** 佔住唯一的執行緒並填滿佇列 */
    private void saturate() throws InterruptedException {
        CountDownLatch running = new CountDownLatch(1);
        executor.execute(() -> {
            running.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(running.await(2, TimeUnit.SECONDS)).isTrue();
        executor.execute(() -> { });
    }
}
