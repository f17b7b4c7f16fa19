package com.example.mltranslation.mq.producer;

import com.example.mltranslation.exception.TaskPublishException;
import com.example.mltranslation.mq.config.RocketMQProperties;
import com.example.mltranslation.mq.msg.TranslationTaskMsg;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.rocketmq.client.producer.DefaultMQProducer;
import org.apache.rocketmq.client.producer.SendResult;
import org.apache.rocketmq.client.producer.SendStatus;
import org.apache.rocketmq.common.message.Message;
import org.apache.rocketmq.common.message.MessageExt;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

import static com.example.mltranslation.mq.constants.MQConstants.*;

/**
 * 翻譯任務 Producer
 *
 * 職責：
 * 1. 發布新任務（publish）
 * 2. 重新發布待重試的任務（republish，附延遲等級）
 * 3. 發布死信（publishDeadLetter / publishRawDeadLetter）
 *
 * 訊息格式：
 * - body: TranslationTaskMsg JSON（UTF-8）
 * - key / correlationId 屬性: 任務 ID
 * - attempts 屬性: 已失敗的處理次數
 * - waitStoreMsgOK = true（broker 寫入儲存後才回應）
 *
 * 錯誤處理：
 * - 同步發送，失敗時依 publish-max-attempts 重試
 * - 仍失敗則拋出 TaskPublishException，由上層決定如何處理
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TranslationTaskProducer {

    private final DefaultMQProducer producer;
    private final ObjectMapper objectMapper;
    private final RocketMQProperties properties;

    /**
     * 發布新任務
     *
     * @param task 任務內容；taskId 為 null 時自動產生 UUID
     * @return 任務 ID
     * @throws TaskPublishException 重試後仍無法發布
     */
    public String publish(TranslationTaskMsg task) {
        if (task.getTaskId() == null || task.getTaskId().isBlank()) {
            task.setTaskId(UUID.randomUUID().toString());
        }
        if (task.getTimestamp() == 0) {
            task.setTimestamp(System.currentTimeMillis());
        }

        Message message = buildMessage(TOPIC_TRANSLATION_TASKS, task, 0);
        send(message, task.getTaskId(), 0);
        log.info("Published translation task: taskId={}, userId={}, {} -> {}",
                task.getTaskId(), task.getUserId(), task.getSourceLang(), task.getTargetLang());
        return task.getTaskId();
    }

    /**
     * 重新發布任務（處理失敗、尚有重試次數）
     *
     * @param task 任務內容
     * @param attempts 已失敗的處理次數
     * @param delayLevel RocketMQ 延遲等級（<= 0 表示不延遲）
     */
    public void republish(TranslationTaskMsg task, int attempts, int delayLevel) {
        Message message = buildMessage(TOPIC_TRANSLATION_TASKS, task, attempts);
        if (delayLevel > 0) {
            message.setDelayTimeLevel(delayLevel);
        }
        send(message, task.getTaskId(), attempts);
        log.info("Re-published translation task: taskId={}, attempts={}, delayLevel={}",
                task.getTaskId(), attempts, delayLevel);
    }

    /**
     * 發布死信
     *
     * @param task 任務內容
     * @param attempts 處理次數
     * @param reason 失敗原因
     * @param retryable 失敗是否屬於暫時性錯誤（重試耗盡）
     */
    public void publishDeadLetter(TranslationTaskMsg task, int attempts, String reason, boolean retryable) {
        Message message = buildMessage(TOPIC_TRANSLATION_TASKS_FAILED, task, attempts);
        markFailed(message, reason, retryable);
        send(message, task.getTaskId(), attempts);
        log.error("Dead-lettered translation task: taskId={}, userId={}, attempts={}, retryable={}, reason={}",
                task.getTaskId(), task.getUserId(), attempts, retryable, reason);
    }

    /**
     * 原樣轉發無法解析的訊息至死信 Topic
     *
     * @param original 原始訊息
     * @param reason 失敗原因
     */
    public void publishRawDeadLetter(MessageExt original, String reason) {
        String taskId = original.getUserProperty(PROPERTY_CORRELATION_ID);
        if (taskId == null) {
            taskId = original.getMsgId();
        }
        Message message = new Message(TOPIC_TRANSLATION_TASKS_FAILED, null, taskId, original.getBody());
        message.setWaitStoreMsgOK(true);
        message.putUserProperty(PROPERTY_CORRELATION_ID, taskId);
        markFailed(message, reason, false);
        send(message, taskId, 0);
        log.error("Dead-lettered unparseable message: msgId={}, reason={}", original.getMsgId(), reason);
    }

    private Message buildMessage(String topic, TranslationTaskMsg task, int attempts) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsString(task).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new TaskPublishException(task.getTaskId(), 0, e);
        }

        // 任務 ID 作為 message key，可於 console 依 key 查詢
        Message message = new Message(topic, null, task.getTaskId(), body);
        message.setWaitStoreMsgOK(true);
        message.putUserProperty(PROPERTY_CORRELATION_ID, task.getTaskId());
        message.putUserProperty(PROPERTY_ATTEMPTS, String.valueOf(attempts));
        return message;
    }

    private static void markFailed(Message message, String reason, boolean retryable) {
        message.putUserProperty(PROPERTY_FAILED, "true");
        message.putUserProperty(PROPERTY_RETRYABLE, String.valueOf(retryable));
        message.putUserProperty(PROPERTY_FAILURE_REASON, truncate(reason));
    }

    private void send(Message message, String taskId, int attempts) {
        int maxAttempts = Math.max(1, properties.getProducer().getPublishMaxAttempts());
        Duration retryDelay = properties.getProducer().getPublishRetryDelay();

        Exception lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                SendResult result = producer.send(message);
                if (result.getSendStatus() != SendStatus.SEND_OK) {
                    log.warn("MQ message stored with status {}: topic={}, taskId={}, msgId={}",
                            result.getSendStatus(), message.getTopic(), taskId, result.getMsgId());
                }
                log.debug("Sent MQ message: topic={}, taskId={}, attempts={}, msgId={}",
                        message.getTopic(), taskId, attempts, result.getMsgId());
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskPublishException(taskId, attempt, e);
            } catch (Exception e) {
                lastError = e;
                log.warn("Failed to send MQ message (attempt {}/{}): topic={}, taskId={}, error={}",
                        attempt, maxAttempts, message.getTopic(), taskId, e.getMessage());
            }

            if (attempt < maxAttempts) {
                pause(retryDelay, taskId, attempt);
            }
        }

        log.error("Giving up sending MQ message: topic={}, taskId={}", message.getTopic(), taskId, lastError);
        throw new TaskPublishException(taskId, maxAttempts, lastError);
    }

    private static void pause(Duration delay, String taskId, int attempt) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskPublishException(taskId, attempt, e);
        }
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return "unknown";
        }
        return reason.length() <= MAX_REASON_LENGTH ? reason : reason.substring(0, MAX_REASON_LENGTH);
    }
}
