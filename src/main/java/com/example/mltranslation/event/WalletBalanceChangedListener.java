package com.example.mltranslation.event;

import com.example.mltranslation.service.WalletService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 錢包餘額變更監聽器
 *
 * 關鍵設定：
 * - @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
 * - 只有在事務成功提交後才清除快取，rollback 時快取維持原值
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WalletBalanceChangedListener {

    private final WalletService walletService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleWalletBalanceChanged(WalletBalanceChangedEvent event) {
        try {
            walletService.evictBalanceCache(event.getUserId());
            log.debug("Evicted balance cache: userId={}, delta={}", event.getUserId(), event.getDelta());
        } catch (Exception e) {
            // 事務已提交，快取會在 TTL 到期後自行更新
            log.error("Failed to evict balance cache: userId={}", event.getUserId(), e);
        }
    }
}
