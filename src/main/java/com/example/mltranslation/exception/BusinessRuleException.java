package com.example.mltranslation.exception;

/**
 * 業務規則異常基底類別（不可重試）
 *
 * 驗證錯誤（空白輸入、金額、語言代碼）與業務規則（餘額不足、使用者不存在、email 重複）。
 * 同一請求重試結果相同，佇列 worker 直接送往 dead-letter，不重新發布。
 */
public abstract class BusinessRuleException extends RuntimeException {

    protected BusinessRuleException(String message) {
        super(message);
    }
}
