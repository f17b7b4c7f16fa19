package com.example.mltranslation.facade.impl;

import com.example.mltranslation.config.TranslationProperties;
import com.example.mltranslation.entity.Translation;
import com.example.mltranslation.exception.MalformedTaskException;
import com.example.mltranslation.exception.WalletLockTimeoutException;
import com.example.mltranslation.facade.TranslationFacade;
import com.example.mltranslation.facade.dto.TaskStatus;
import com.example.mltranslation.facade.dto.TaskStatusResponse;
import com.example.mltranslation.facade.dto.TaskSubmissionResponse;
import com.example.mltranslation.facade.dto.TranslateRequest;
import com.example.mltranslation.facade.dto.TranslateResponse;
import com.example.mltranslation.mq.msg.TranslationTaskMsg;
import com.example.mltranslation.mq.producer.TranslationTaskProducer;
import com.example.mltranslation.service.HistoryService;
import com.example.mltranslation.service.InsufficientFundsPolicy;
import com.example.mltranslation.service.TranslationCommand;
import com.example.mltranslation.service.TranslationOutcome;
import com.example.mltranslation.service.TranslationRequestProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * TranslationFacade 實作
 *
 * 協調邏輯：
 * - 將 HTTP 請求或 MQ 訊息轉換為 TranslationCommand
 * - 依入口套用對應的餘額不足策略
 * - 統一例外轉換與日誌記錄
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TranslationFacadeImpl implements TranslationFacade {

    private final TranslationRequestProcessor processor;
    private final HistoryService historyService;
    private final TranslationTaskProducer producer;
    private final TranslationProperties properties;

    @Override
    public TranslateResponse translate(Long userId, TranslateRequest request) {
        log.info("Processing translate request: userId={}, {} -> {}",
                userId, request.getSourceLang(), request.getTargetLang());

        TranslationCommand command = TranslationCommand.builder()
                .userId(userId)
                .inputText(request.getInputText())
                .sourceLang(request.getSourceLang())
                .targetLang(request.getTargetLang())
                .build();

        TranslationOutcome outcome = process(command, properties.getPolicy().getSync());
        return toResponse(outcome);
    }

    @Override
    public TaskSubmissionResponse submitTask(Long userId, TranslateRequest request) {
        TranslationTaskMsg msg = TranslationTaskMsg.builder()
                .userId(userId)
                .inputText(request.getInputText().trim())
                .sourceLang(request.getSourceLang())
                .targetLang(request.getTargetLang())
                .timestamp(System.currentTimeMillis())
                .build();

        String taskId = producer.publish(msg);
        log.info("Translation task queued: taskId={}, userId={}", taskId, userId);

        return TaskSubmissionResponse.builder()
                .taskId(taskId)
                .status(TaskStatus.QUEUED)
                .build();
    }

    @Override
    public TaskStatusResponse getTaskStatus(Long userId, String taskId) {
        Optional<Translation> result = historyService.findTaskResult(taskId, userId);
        if (result.isEmpty()) {
            return TaskStatusResponse.builder()
                    .taskId(taskId)
                    .status(TaskStatus.PENDING)
                    .build();
        }

        return TaskStatusResponse.builder()
                .taskId(taskId)
                .status(TaskStatus.DONE)
                .outputText(result.get().getOutputText())
                .cost(result.get().getCost())
                .build();
    }

    @Override
    public TranslationOutcome handleTranslationTask(TranslationTaskMsg msg) {
        log.info("Processing translation task: taskId={}, userId={}, {} -> {}",
                msg.getTaskId(), msg.getUserId(), msg.getSourceLang(), msg.getTargetLang());

        // 1. 訊息完整性檢查
        if (msg.getUserId() == null) {
            throw new MalformedTaskException("Task " + msg.getTaskId() + " has no user id");
        }

        // 2. 任務 ID 作為冪等鍵
        TranslationCommand command = TranslationCommand.builder()
                .userId(msg.getUserId())
                .inputText(msg.getInputText())
                .sourceLang(msg.getSourceLang())
                .targetLang(msg.getTargetLang())
                .externalId(msg.getTaskId())
                .build();

        TranslationOutcome outcome = process(command, properties.getPolicy().getQueued());
        log.info("Translation task processed: taskId={}, userId={}, cost={}, replayed={}",
                msg.getTaskId(), msg.getUserId(), outcome.getCost(), outcome.isReplayed());
        return outcome;
    }

    private TranslationOutcome process(TranslationCommand command, InsufficientFundsPolicy policy) {
        try {
            return processor.process(command, policy);

        } catch (PessimisticLockingFailureException e) {
            // 鎖等待逾時或死結：整筆已 rollback，可安全重試
            log.error("Wallet lock timeout: userId={}, externalId={}", command.getUserId(), command.getExternalId(), e);
            throw new WalletLockTimeoutException(command.getUserId(), e);

        } catch (DataIntegrityViolationException e) {
            // 同一 external_id 的併發處理已先提交
            if (command.getExternalId() == null) {
                throw e;
            }
            log.warn("Concurrent completion detected, replaying: userId={}, externalId={}",
                    command.getUserId(), command.getExternalId());
            return processor.findCompleted(command.getExternalId(), command.getUserId())
                    .orElseThrow(() -> e);
        }
    }

    private static TranslateResponse toResponse(TranslationOutcome outcome) {
        return TranslateResponse.builder()
                .externalId(outcome.getExternalId())
                .inputText(outcome.getInputText())
                .outputText(outcome.getOutputText())
                .sourceLang(outcome.getSourceLang())
                .targetLang(outcome.getTargetLang())
                .cost(outcome.getCost())
                .createdAt(outcome.getCreatedAt())
                .build();
    }
}
