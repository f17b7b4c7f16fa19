package com.example.mltranslation.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * 錢包餘額變更事件
 *
 * 由 WalletService.credit / debit 在交易內發布，
 * WalletBalanceChangedListener 於交易提交後處理（清除餘額快取）。
 * 交易 rollback 時不會被處理。
 */
@Getter
public class WalletBalanceChangedEvent extends ApplicationEvent {

    private final Long userId;
    private final long balanceBefore;
    private final long balanceAfter;

    public WalletBalanceChangedEvent(Object source, Long userId, long balanceBefore, long balanceAfter) {
        super(source);
        this.userId = userId;
        this.balanceBefore = balanceBefore;
        this.balanceAfter = balanceAfter;
    }

    public long getDelta() {
        return balanceAfter - balanceBefore;
    }
}
