package com.example.mltranslation.exception;

/**
 * 翻譯失敗或逾時
 *
 * 整個工作單元 rollback：釋放錢包鎖、不扣款、不寫入紀錄。
 * 佇列 worker 視為暫時性錯誤，次數未達上限時重新發布任務。
 */
public class TranslationFailedException extends RuntimeException {

    private final boolean timedOut;

    public TranslationFailedException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public TranslationFailedException(String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
