package com.example.mltranslation.config;

import com.example.mltranslation.service.InsufficientFundsPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Translation protocol settings (prefix "translation")
 *
 * Read once at start-up and injected into the processor, facades and worker; nothing
 * re-reads the environment per request.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "translation")
public class TranslationProperties {

    /**
     * Credits charged per translation request.
     */
    private int costPerRequest = 1;

    /**
     * Upper bound for a single translator call. The wallet lock is held during the call,
     * so this also bounds how long other requests of the same user wait.
     */
    private Duration translatorTimeout = Duration.ofSeconds(10);

    /**
     * Threads available to run translator calls.
     */
    private int translatorThreads = 8;

    /**
     * Translator calls allowed to wait for a free thread. Calls beyond this are rejected.
     */
    private int translatorQueueCapacity = 16;

    private Policy policy = new Policy();

    private Worker worker = new Worker();

    private Admin admin = new Admin();

    /**
     * Insufficient-funds policy per entry point.
     */
    @Data
    public static class Policy {
        private InsufficientFundsPolicy sync = InsufficientFundsPolicy.STRICT;
        private InsufficientFundsPolicy queued = InsufficientFundsPolicy.STRICT;
    }

    @Data
    public static class Worker {
        /**
         * Starts the task consumer in this process.
         */
        private boolean enabled = false;

        /**
         * Total processing attempts per task, first delivery included.
         */
        private int maxAttempts = 5;

        /**
         * RocketMQ delay level applied to re-published tasks (1 = 1s, 2 = 5s, 3 = 10s, ...).
         */
        private int retryDelayLevel = 1;
    }

    /**
     * Optional administrator account created at start-up when missing.
     */
    @Data
    public static class Admin {
        private String email;
        private String password;
    }
}
