package com.example.mltranslation.config;

import com.example.mltranslation.translator.DictionaryTranslator;
import com.example.mltranslation.translator.TimeLimitedTranslator;
import com.example.mltranslation.translator.Translator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 翻譯器配置
 *
 * DictionaryTranslator 外層包覆 TimeLimitedTranslator，
 * 以 translation.translator-timeout 限制單次翻譯時間。
 *
 * 執行緒池固定大小且佇列有上限；佇列滿時直接拒絕，
 * 由 TimeLimitedTranslator 轉為 TranslationFailedException（503）。
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class TranslatorConfig {

    private final TranslationProperties properties;

    @Bean
    public ThreadPoolTaskExecutor translatorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getTranslatorThreads());
        executor.setMaxPoolSize(properties.getTranslatorThreads());
        executor.setQueueCapacity(properties.getTranslatorQueueCapacity());
        executor.setThreadNamePrefix("translator-");

        // 佇列滿：拒絕，不在呼叫端執行（呼叫端持有錢包鎖）
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        // 關閉時中斷執行中的翻譯
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public Translator translator(ThreadPoolTaskExecutor translatorExecutor) {
        log.info("Translator initialized: threads={}, queueCapacity={}, timeout={}",
            properties.getTranslatorThreads(), properties.getTranslatorQueueCapacity(),
            properties.getTranslatorTimeout());
        return new TimeLimitedTranslator(new DictionaryTranslator(),
            translatorExecutor.getThreadPoolExecutor(), properties.getTranslatorTimeout());
    }
}
