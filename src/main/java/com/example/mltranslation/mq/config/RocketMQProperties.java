package com.example.mltranslation.mq.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * RocketMQ 配置屬性
 *
 * 集中管理從 application.yaml 讀取的 RocketMQ 配置
 */
@Data
@Component
@ConfigurationProperties(prefix = "rocketmq")
public class RocketMQProperties {

    /**
     * NameServer 地址
     */
    private String nameServer;

    /**
     * Producer 配置
     */
    private Producer producer = new Producer();

    /**
     * Consumer 配置
     */
    private Consumer consumer = new Consumer();

    @Data
    public static class Producer {
        private String group;
        private int sendMessageTimeout = 3000;
        private int retryTimesWhenSendFailed = 2;

        /**
         * 發布任務的應用層重試次數（含第一次）
         */
        private int publishMaxAttempts = 3;

        /**
         * 應用層重試間隔
         */
        private Duration publishRetryDelay = Duration.ofMillis(200);
    }

    @Data
    public static class Consumer {
        /**
         * Broker 端重送上限（僅在 consumer 回傳 RECONSUME_LATER 時使用）
         */
        private int maxReconsumeTimes = 16;
    }
}
