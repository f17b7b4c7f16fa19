package com.example.mltranslation.translator;

import com.example.mltranslation.exception.BusinessRuleException;
import com.example.mltranslation.exception.TranslationFailedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 限時翻譯器
 *
 * 於獨立執行緒池執行實際翻譯，超過 timeout 即取消並拋出 TranslationFailedException。
 * 呼叫端在持有錢包鎖的情況下呼叫翻譯器，因此鎖的持有時間上限即為 timeout。
 *
 * 例外轉換：
 * - BusinessRuleException（如不支援的語言組合）：原樣拋出
 * - TranslationFailedException：原樣拋出
 * - 其他例外：包裝為 TranslationFailedException
 */
@Slf4j
public class TimeLimitedTranslator implements Translator {

    private final Translator delegate;
    private final ExecutorService executor;
    private final Duration timeout;

    public TimeLimitedTranslator(Translator delegate, ExecutorService executor, Duration timeout) {
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public String translate(String text, String sourceLang, String targetLang) {
        Future<String> future;
        try {
            future = executor.submit(() -> delegate.translate(text, sourceLang, targetLang));
        } catch (RejectedExecutionException e) {
            throw new TranslationFailedException("Translator is not accepting work", e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Translation timed out: {} -> {}, timeout={}", sourceLang, targetLang, timeout);
            throw new TranslationFailedException("Translation timed out after " + timeout.toMillis() + " ms", e, true);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TranslationFailedException("Interrupted while waiting for translation", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BusinessRuleException businessError) {
                throw businessError;
            }
            if (cause instanceof TranslationFailedException translationError) {
                throw translationError;
            }
            throw new TranslationFailedException("Translator failed: " + cause.getMessage(), cause);
        }
    }
}
