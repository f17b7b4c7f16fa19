package com.example.mltranslation.mq.consumer;

import com.example.mltranslation.config.TranslationProperties;
import com.example.mltranslation.exception.BusinessRuleException;
import com.example.mltranslation.exception.TaskPublishException;
import com.example.mltranslation.facade.TranslationFacade;
import com.example.mltranslation.mq.config.RocketMQProperties;
import com.example.mltranslation.mq.msg.TranslationTaskMsg;
import com.example.mltranslation.mq.producer.TranslationTaskProducer;
import com.example.mltranslation.service.TranslationOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.rocketmq.client.consumer.DefaultMQPushConsumer;
import org.apache.rocketmq.client.consumer.listener.ConsumeConcurrentlyStatus;
import org.apache.rocketmq.client.consumer.listener.MessageListenerConcurrently;
import org.apache.rocketmq.common.message.MessageExt;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;

import static com.example.mltranslation.mq.constants.MQConstants.*;

/**
 * 翻譯任務消費者（worker）
 * <p>
 * 職責：
 * 1. 監聽 translation-tasks topic，一次只處理一個任務
 * 2. 委派給 TranslationFacade 執行翻譯請求（任務 ID 作為冪等鍵）
 * 3. 依例外類型決定 ack、重新發布或死信
 * <p>
 * 錯誤處理策略：
 * - 成功：CONSUME_SUCCESS（ack）
 * - 業務錯誤（BusinessRuleException，如餘額不足、使用者不存在）：
 * ack 並立即發布死信（failed=true, retryable=false），重試也無法成功
 * - 系統異常（翻譯逾時、鎖等待逾時、資料庫錯誤等）：
 * ack 並以 attempts + 1 重新發布（延遲等級 retry-delay-level），
 * attempts + 1 達到 max-attempts 時改為發布死信
 * - 無法解析的訊息：原樣發布死信
 * - 重新發布或死信發布失敗：RECONSUME_LATER，由 broker 重送（冪等性保證不會重複扣款）
 * <p>
 * 處理完成前不 ack；worker 當機時 broker 會將任務重送給其他 worker。
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "translation.worker", name = "enabled", havingValue = "true")
public class TranslationTaskConsumer {

    private final TranslationFacade translationFacade;
    private final TranslationTaskProducer producer;
    private final ObjectMapper objectMapper;
    private final RocketMQProperties rocketMQProperties;
    private final TranslationProperties translationProperties;

    private DefaultMQPushConsumer consumer;

    /**
     * 啟動 Consumer
     */
    @PostConstruct
    public void start() throws Exception {
        consumer = new DefaultMQPushConsumer(GROUP_TRANSLATION_WORKER);
        consumer.setNamesrvAddr(rocketMQProperties.getNameServer());
        consumer.subscribe(TOPIC_TRANSLATION_TASKS, "*");
        consumer.setConsumeThreadMin(CONSUMER_THREADS);
        consumer.setConsumeThreadMax(CONSUMER_THREADS);
        consumer.setConsumeMessageBatchMaxSize(CONSUME_BATCH_SIZE);
        consumer.setPullBatchSize(CONSUME_BATCH_SIZE);
        consumer.setMaxReconsumeTimes(rocketMQProperties.getConsumer().getMaxReconsumeTimes());

        consumer.registerMessageListener((MessageListenerConcurrently) (msgs, context) -> {
            for (MessageExt msg : msgs) {
                ConsumeConcurrentlyStatus status = handle(msg);
                if (status != ConsumeConcurrentlyStatus.CONSUME_SUCCESS) {
                    return status;
                }
            }
            return ConsumeConcurrentlyStatus.CONSUME_SUCCESS;
        });

        consumer.start();
        log.info("TranslationTaskConsumer started: group={}, topic={}, maxAttempts={}",
                GROUP_TRANSLATION_WORKER, TOPIC_TRANSLATION_TASKS, translationProperties.getWorker().getMaxAttempts());
    }

    @PreDestroy
    public void shutdown() {
        if (consumer != null) {
            consumer.shutdown();
            log.info("TranslationTaskConsumer stopped");
        }
    }

    /**
     * 處理單一訊息
     *
     * @param message RocketMQ 訊息
     * @return CONSUME_SUCCESS（已處理、已重新發布或已進死信），或 RECONSUME_LATER
     */
    public ConsumeConcurrentlyStatus handle(MessageExt message) {
        // 1. 解析訊息
        TranslationTaskMsg task;
        try {
            task = objectMapper.readValue(message.getBody(), TranslationTaskMsg.class);
        } catch (IOException e) {
            log.error("Unparseable translation task: msgId={}", message.getMsgId(), e);
            return deadLetterRaw(message, "Unparseable payload: " + e.getMessage());
        }

        // 2. 任務 ID：訊息屬性 → body → message key → msgId（同一訊息重送時不變）
        task.setTaskId(resolveTaskId(message, task));
        int attempts = parseAttempts(message);

        // 3. 處理
        try {
            TranslationOutcome outcome = translationFacade.handleTranslationTask(task);
            log.info("Translation task done: taskId={}, attempt={}, replayed={}",
                    task.getTaskId(), attempts + 1, outcome.isReplayed());
            return ConsumeConcurrentlyStatus.CONSUME_SUCCESS;

        } catch (BusinessRuleException e) {
            log.warn("Translation task rejected: taskId={}, userId={}, reason={}",
                    task.getTaskId(), task.getUserId(), e.getMessage());
            return deadLetter(task, attempts + 1, e.getMessage(), false);

        } catch (Exception e) {
            int failedAttempts = attempts + 1;
            int maxAttempts = translationProperties.getWorker().getMaxAttempts();
            log.error("Translation task failed: taskId={}, attempt={}/{}",
                    task.getTaskId(), failedAttempts, maxAttempts, e);

            if (failedAttempts < maxAttempts) {
                return retry(task, failedAttempts);
            }
            return deadLetter(task, failedAttempts, e.getMessage(), true);
        }
    }

    private ConsumeConcurrentlyStatus retry(TranslationTaskMsg task, int attempts) {
        try {
            producer.republish(task, attempts, translationProperties.getWorker().getRetryDelayLevel());
            return ConsumeConcurrentlyStatus.CONSUME_SUCCESS;
        } catch (TaskPublishException e) {
            log.error("Failed to re-publish task, leaving it to broker redelivery: taskId={}", task.getTaskId(), e);
            return ConsumeConcurrentlyStatus.RECONSUME_LATER;
        }
    }

    private ConsumeConcurrentlyStatus deadLetter(TranslationTaskMsg task, int attempts, String reason, boolean retryable) {
        try {
            producer.publishDeadLetter(task, attempts, reason, retryable);
            return ConsumeConcurrentlyStatus.CONSUME_SUCCESS;
        } catch (TaskPublishException e) {
            log.error("Failed to dead-letter task, leaving it to broker redelivery: taskId={}", task.getTaskId(), e);
            return ConsumeConcurrentlyStatus.RECONSUME_LATER;
        }
    }

    private ConsumeConcurrentlyStatus deadLetterRaw(MessageExt message, String reason) {
        try {
            producer.publishRawDeadLetter(message, reason);
            return ConsumeConcurrentlyStatus.CONSUME_SUCCESS;
        } catch (TaskPublishException e) {
            log.error("Failed to dead-letter unparseable message: msgId={}", message.getMsgId(), e);
            return ConsumeConcurrentlyStatus.RECONSUME_LATER;
        }
    }

    private static String resolveTaskId(MessageExt message, TranslationTaskMsg task) {
        String correlationId = message.getUserProperty(PROPERTY_CORRELATION_ID);
        if (correlationId != null && !correlationId.isBlank()) {
            return correlationId;
        }
        if (task.getTaskId() != null && !task.getTaskId().isBlank()) {
            return task.getTaskId();
        }
        String keys = message.getKeys();
        if (keys != null && !keys.isBlank()) {
            return keys.trim().split(" ")[0];
        }
        return message.getMsgId();
    }

    private static int parseAttempts(MessageExt message) {
        String value = message.getUserProperty(PROPERTY_ATTEMPTS);
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed attempts property '{}': msgId={}", value, message.getMsgId());
            return 0;
        }
    }
}
