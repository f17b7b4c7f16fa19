package com.example.mltranslation.schedule;

import com.example.mltranslation.repository.WalletLedgerMismatch;
import com.example.mltranslation.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ledger Reconciliation Scheduled Job
 *
 * 定時任務：比對錢包餘額與帳本加總
 *
 * 職責：
 * - 按照 scheduler.reconciliation.cron 定時觸發（"-" 表示停用）
 * - 委派給 ReconciliationService 查詢不一致的錢包
 * - 每筆不一致以 WARN 記錄；不修正任何資料
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerReconciliationJob {

    private final ReconciliationService reconciliationService;

    @Scheduled(cron = "${scheduler.reconciliation.cron}")
    @SchedulerLock(
        name = "reconcileWalletLedger",
        lockAtMostFor = "${scheduler.reconciliation.lock-at-most-seconds}s",
        lockAtLeastFor = "${scheduler.reconciliation.lock-at-least-seconds}s"
    )
    public void reconcile() {
        log.info("Starting ledger reconciliation (lock acquired)");

        try {
            List<WalletLedgerMismatch> mismatches = reconciliationService.findMismatches();
            for (WalletLedgerMismatch mismatch : mismatches) {
                log.warn("Wallet balance differs from ledger: userId={}, balance={}, ledgerBalance={}",
                        mismatch.getUserId(), mismatch.getBalance(), mismatch.getLedgerBalance());
            }

            log.info("Ledger reconciliation completed: {} mismatched wallets", mismatches.size());
        } catch (Exception e) {
            log.error("Ledger reconciliation failed: {}", e.getMessage(), e);
        }
    }
}
