package com.example.mltranslation.service;

import com.example.mltranslation.entity.Wallet;
import com.example.mltranslation.event.WalletBalanceChangedEvent;
import com.example.mltranslation.exception.InsufficientFundsException;
import com.example.mltranslation.exception.InvalidAmountException;
import com.example.mltranslation.exception.UserNotFoundException;
import com.example.mltranslation.repository.UserRepository;
import com.example.mltranslation.repository.WalletRepository;
import com.example.mltranslation.service.impl.WalletServiceImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * WalletService 單元測試
 *
 * 測試策略：
 * 1. 使用 Mockito mock Repositories 與事件發布器
 * 2. 純單元測試，不啟動 Spring Context
 * 3. 鎖定與快取行為由整合測試驗證
 *
 * 測試範圍：
 * - getOrCreate / lockForUpdate: 延遲建立錢包
 * - credit / debit: 金額驗證、餘額不足、事件發布
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("WalletService Unit Tests")
class WalletServiceTest {

    @Mock
    private WalletRepository walletRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private WalletServiceImpl walletService;

    // ==================== getOrCreate ====================

    @Test
    @DisplayName("getOrCreate - With existing wallet - Returns it without insert")
    void getOrCreate_WithExistingWallet_ReturnsItWithoutInsert() {
        // Given
        Wallet wallet = wallet(1L, 10L);
        when(walletRepository.findById(1L)).thenReturn(Optional.of(wallet));

        // When
        Wallet result = walletService.getOrCreate(1L);

        // Then
        assertThat(result).isSameAs(wallet);
        verify(walletRepository, never()).insertIfAbsent(anyLong());
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("getOrCreate - With missing wallet - Inserts zero-balance wallet and re-reads")
    void getOrCreate_WithMissingWallet_InsertsAndReReads() {
        // Given
        Wallet created = wallet(2L, 0L);
        when(walletRepository.findById(2L)).thenReturn(Optional.empty(), Optional.of(created));
        when(userRepository.existsById(2L)).thenReturn(true);
        when(walletRepository.insertIfAbsent(2L)).thenReturn(1);

        // When
        Wallet result = walletService.getOrCreate(2L);

        // Then
        assertThat(result.getBalance()).isZero();
        verify(walletRepository, times(1)).insertIfAbsent(2L);
        verify(walletRepository, times(2)).findById(2L);
    }

    @Test
    @DisplayName("getOrCreate - With unknown user - Throws UserNotFoundException")
    void getOrCreate_WithUnknownUser_ThrowsUserNotFoundException() {
        // Given
        when(walletRepository.findById(99L)).thenReturn(Optional.empty());
        when(userRepository.existsById(99L)).thenReturn(false);

        // When & Then
        assertThatThrownBy(() -> walletService.getOrCreate(99L))
            .isInstanceOf(UserNotFoundException.class)
            .hasMessageContaining("99");

        verify(walletRepository, never()).insertIfAbsent(anyLong());
    }

    // ==================== lockForUpdate ====================

    @Test
    @DisplayName("lockForUpdate - With existing wallet - Returns locked row")
    void lockForUpdate_WithExistingWallet_ReturnsLockedRow() {
        // Given
        Wallet wallet = wallet(3L, 5L);
        when(walletRepository.findByUserIdForUpdate(3L)).thenReturn(Optional.of(wallet));

        // When
        Wallet result = walletService.lockForUpdate(3L);

        // Then
        assertThat(result).isSameAs(wallet);
        verify(walletRepository, never()).insertIfAbsent(anyLong());
    }

    @Test
    @DisplayName("lockForUpdate - With missing wallet - Creates then locks")
    void lockForUpdate_WithMissingWallet_CreatesThenLocks() {
        // Given
        Wallet created = wallet(4L, 0L);
        when(walletRepository.findByUserIdForUpdate(4L)).thenReturn(Optional.empty(), Optional.of(created));
        when(userRepository.existsById(4L)).thenReturn(true);
        when(walletRepository.insertIfAbsent(4L)).thenReturn(0);

        // When
        Wallet result = walletService.lockForUpdate(4L);

        // Then
        assertThat(result).isSameAs(created);
        verify(walletRepository, times(2)).findByUserIdForUpdate(4L);
    }

    // ==================== credit / debit ====================

    @Test
    @DisplayName("credit - With positive amount - Increases balance and publishes event")
    void credit_WithPositiveAmount_IncreasesBalanceAndPublishesEvent() {
        // Given
        Wallet wallet = wallet(5L, 10L);

        // When
        long result = walletService.credit(wallet, 15L);

        // Then
        assertThat(result).isEqualTo(25L);
        assertThat(wallet.getBalance()).isEqualTo(25L);
        verify(walletRepository).save(wallet);

        ArgumentCaptor<WalletBalanceChangedEvent> captor = ArgumentCaptor.forClass(WalletBalanceChangedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getUserId()).isEqualTo(5L);
        assertThat(captor.getValue().getBalanceBefore()).isEqualTo(10L);
        assertThat(captor.getValue().getBalanceAfter()).isEqualTo(25L);
    }

    @Test
    @DisplayName("credit - With zero amount - Throws InvalidAmountException")
    void credit_WithZeroAmount_ThrowsInvalidAmountException() {
        Wallet wallet = wallet(6L, 10L);

        assertThatThrownBy(() -> walletService.credit(wallet, 0L))
            .isInstanceOf(InvalidAmountException.class);

        assertThat(wallet.getBalance()).isEqualTo(10L);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("credit - With overflowing amount - Throws InvalidAmountException and keeps balance")
    void credit_WithOverflowingAmount_ThrowsInvalidAmountException() {
        Wallet wallet = wallet(6L, Long.MAX_VALUE - 5);

        assertThatThrownBy(() -> walletService.credit(wallet, 10L))
            .isInstanceOf(InvalidAmountException.class)
            .hasMessageContaining("overflow");

        assertThat(wallet.getBalance()).isEqualTo(Long.MAX_VALUE - 5);
        verify(walletRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("debit - With exact balance - Leaves zero balance")
    void debit_WithExactBalance_LeavesZeroBalance() {
        // Given
        Wallet wallet = wallet(7L, 1L);

        // When
        long result = walletService.debit(wallet, 1L);

        // Then
        assertThat(result).isZero();
        verify(walletRepository).save(wallet);
        verify(eventPublisher).publishEvent(any(WalletBalanceChangedEvent.class));
    }

    @Test
    @DisplayName("debit - With insufficient balance - Throws and leaves wallet untouched")
    void debit_WithInsufficientBalance_ThrowsAndLeavesWalletUntouched() {
        // Given
        Wallet wallet = wallet(8L, 0L);

        // When & Then
        assertThatThrownBy(() -> walletService.debit(wallet, 1L))
            .isInstanceOf(InsufficientFundsException.class)
            .satisfies(e -> {
                InsufficientFundsException ex = (InsufficientFundsException) e;
                assertThat(ex.getCurrentBalance()).isZero();
                assertThat(ex.getRequiredAmount()).isEqualTo(1L);
            });

        assertThat(wallet.getBalance()).isZero();
        verify(walletRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("debit - With negative amount - Throws InvalidAmountException")
    void debit_WithNegativeAmount_ThrowsInvalidAmountException() {
        Wallet wallet = wallet(9L, 10L);

        assertThatThrownBy(() -> walletService.debit(wallet, -1L))
            .isInstanceOf(InvalidAmountException.class);
    }

    @Test
    @DisplayName("getBalance - With existing wallet - Returns stored balance")
    void getBalance_WithExistingWallet_ReturnsStoredBalance() {
        when(walletRepository.findById(10L)).thenReturn(Optional.of(wallet(10L, 42L)));

        assertThat(walletService.getBalance(10L)).isEqualTo(42L);
    }

    private static Wallet wallet(Long userId, long balance) {
        return Wallet.builder()
            .userId(userId)
            .balance(balance)
            .version(0L)
            .build();
    }
}
