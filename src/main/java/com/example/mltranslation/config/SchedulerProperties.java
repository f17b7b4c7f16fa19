package com.example.mltranslation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "scheduler.reconciliation")
public class SchedulerProperties {

    /**
     * Cron expression for the ledger reconciliation job.
     * "-" disables the job.
     */
    private String cron;

    /**
     * Maximum lock duration in seconds.
     * The lock is released after this duration even if the job crashes.
     */
    private int lockAtMostSeconds;

    /**
     * Minimum lock duration in seconds.
     * Prevents another instance from re-running the job right after completion.
     */
    private int lockAtLeastSeconds;
}
