package com.example.mltranslation.facade;

import com.example.mltranslation.facade.dto.TaskStatusResponse;
import com.example.mltranslation.facade.dto.TaskSubmissionResponse;
import com.example.mltranslation.facade.dto.TranslateRequest;
import com.example.mltranslation.facade.dto.TranslateResponse;
import com.example.mltranslation.mq.msg.TranslationTaskMsg;
import com.example.mltranslation.service.TranslationOutcome;

/**
 * Translation Facade
 *
 * 職責：
 * 1. 同步翻譯（translation.policy.sync）
 * 2. 發布非同步翻譯任務與查詢任務狀態
 * 3. 處理 worker 收到的任務（translation.policy.queued），任務 ID 作為冪等鍵
 * 4. 例外轉換：
 *    - PessimisticLockingFailureException → WalletLockTimeoutException（可重試）
 *    - external_id 唯一鍵衝突 → 重放既有結果
 */
public interface TranslationFacade {

    /**
     * 同步翻譯
     *
     * @throws com.example.mltranslation.exception.InsufficientFundsException STRICT 且餘額不足
     * @throws com.example.mltranslation.exception.TranslationFailedException 翻譯失敗或逾時
     * @throws com.example.mltranslation.exception.WalletLockTimeoutException 錢包鎖等待逾時
     */
    TranslateResponse translate(Long userId, TranslateRequest request);

    /**
     * 發布翻譯任務（不檢查餘額，於 worker 處理時扣款）
     *
     * @throws com.example.mltranslation.exception.TaskPublishException 重試後仍無法發布
     */
    TaskSubmissionResponse submitTask(Long userId, TranslateRequest request);

    /**
     * 查詢任務狀態，僅限任務擁有者；他人任務回應 PENDING
     */
    TaskStatusResponse getTaskStatus(Long userId, String taskId);

    /**
     * 處理佇列任務
     *
     * 此方法作為所有 MQ 觸發的翻譯請求的單一入口點。
     * 例外分類由 consumer 決定：BusinessRuleException 進死信，其餘重試。
     *
     * @param msg 來自 MQ 的翻譯任務
     * @return 處理結果（新建或重放）
     */
    TranslationOutcome handleTranslationTask(TranslationTaskMsg msg);
}
