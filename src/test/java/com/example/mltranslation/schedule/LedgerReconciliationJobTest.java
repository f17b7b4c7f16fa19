package com.example.mltranslation.schedule;

import com.example.mltranslation.repository.WalletLedgerMismatch;
import com.example.mltranslation.service.ReconciliationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * LedgerReconciliationJob 單元測試
 *
 * 排程與分散式鎖由 Spring / ShedLock 負責，此處只驗證單次執行的行為。
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("LedgerReconciliationJob Unit Tests")
class LedgerReconciliationJobTest {

    @Mock
    private ReconciliationService reconciliationService;

    @InjectMocks
    private LedgerReconciliationJob job;

    @Test
    @DisplayName("reconcile - With mismatches - Reads each mismatch")
    void reconcile_WithMismatches_ReadsEachMismatch() {
        // Given
        WalletLedgerMismatch mismatch = mock(WalletLedgerMismatch.class);
        when(mismatch.getUserId()).thenReturn(1L);
        when(mismatch.getBalance()).thenReturn(10L);
        when(mismatch.getLedgerBalance()).thenReturn(7L);
        when(reconciliationService.findMismatches()).thenReturn(List.of(mismatch));

        // When
        job.reconcile();

        // Then
        verify(reconciliationService, times(1)).findMismatches();
        verify(mismatch).getLedgerBalance();
    }

    @Test
    @DisplayName("reconcile - With no mismatch - Completes quietly")
    void reconcile_WithNoMismatch_Completes() {
        when(reconciliationService.findMismatches()).thenReturn(List.of());

        assertThatCode(() -> job.reconcile()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("reconcile - With query failure - Catches exception")
    void reconcile_WithQueryFailure_CatchesException() {
        when(reconciliationService.findMismatches()).thenThrow(new RuntimeException("Database error"));

        assertThatCode(() -> job.reconcile()).doesNotThrowAnyException();
    }
}
