package com.example.mltranslation.mq.constants;

/**
 * RocketMQ 常數定義
 *
 * 集中管理 Topic、Consumer Group、訊息屬性名稱
 * 避免在 Producer 和 Consumer 中重複定義
 */
public final class MQConstants {

    private MQConstants() {
        throw new UnsupportedOperationException("Utility class");
    }

    // ==================== Topics ====================

    /**
     * 翻譯任務 Topic
     * 用途：API 發布非同步翻譯任務，worker 消費
     */
    public static final String TOPIC_TRANSLATION_TASKS = "translation-tasks";

    /**
     * 翻譯任務死信 Topic
     * 用途：無法完成的任務（業務錯誤、重試耗盡、無法解析）
     * RocketMQ topic 名稱不可含 '.'，以 "-failed" 為後綴
     */
    public static final String TOPIC_TRANSLATION_TASKS_FAILED = TOPIC_TRANSLATION_TASKS + "-failed";

    // ==================== Consumer Groups ====================

    /**
     * Translation Worker Consumer Group
     * 所有 worker 實例共用，同一任務只會交給其中一個實例
     */
    public static final String GROUP_TRANSLATION_WORKER = "translation-worker-consumer-group";

    // ==================== Message Properties ====================

    /**
     * 任務 ID（同時作為 message key 與冪等鍵 external_id）
     */
    public static final String PROPERTY_CORRELATION_ID = "correlationId";

    /**
     * 已失敗的處理次數（首次發布為 0）
     */
    public static final String PROPERTY_ATTEMPTS = "attempts";

    /**
     * 死信標記
     */
    public static final String PROPERTY_FAILED = "failed";

    public static final String PROPERTY_RETRYABLE = "retryable";

    public static final String PROPERTY_FAILURE_REASON = "reason";

    // ==================== Consumer Configuration ====================

    /**
     * 每個 worker 同時只處理一個任務（prefetch = 1）
     */
    public static final int CONSUMER_THREADS = 1;

    public static final int CONSUME_BATCH_SIZE = 1;

    /**
     * 失敗原因寫入訊息屬性時的最大長度
     */
    public static final int MAX_REASON_LENGTH = 512;
}
