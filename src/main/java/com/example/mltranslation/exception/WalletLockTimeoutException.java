package com.example.mltranslation.exception;

/**
 * 錢包鎖等待逾時（或成為死結犧牲者）
 *
 * 可重試：同步請求回應 503，佇列 worker 重新發布任務
 */
public class WalletLockTimeoutException extends RuntimeException {

    private final Long userId;

    public WalletLockTimeoutException(Long userId, Throwable cause) {
        super(String.format("Could not lock wallet of user %d", userId), cause);
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }
}
