package com.example.mltranslation.service;

import com.example.mltranslation.entity.Transaction;
import com.example.mltranslation.entity.TransactionType;
import com.example.mltranslation.entity.Wallet;
import com.example.mltranslation.exception.InvalidAmountException;
import com.example.mltranslation.exception.UserNotFoundException;
import com.example.mltranslation.repository.TransactionRepository;
import com.example.mltranslation.service.impl.CreditServiceImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CreditService Unit Tests")
class CreditServiceTest {

    @Mock
    private WalletService walletService;

    @Mock
    private TransactionRepository transactionRepository;

    @InjectMocks
    private CreditServiceImpl creditService;

    @Test
    @DisplayName("approveBonus - With positive amount - Credits wallet and records TOPUP")
    void approveBonus_WithPositiveAmount_CreditsWalletAndRecordsTopUp() {
        // Given
        Wallet wallet = Wallet.builder().userId(7L).balance(3L).version(0L).build();
        when(walletService.lockForUpdate(7L)).thenReturn(wallet);
        when(walletService.credit(wallet, 10L)).thenReturn(13L);

        // When
        long balance = creditService.approveBonus(7L, 10L);

        // Then
        assertThat(balance).isEqualTo(13L);
        ArgumentCaptor<Transaction> captor = ArgumentCaptor.forClass(Transaction.class);
        verify(transactionRepository).save(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(TransactionType.TOPUP);
        assertThat(captor.getValue().getAmount()).isEqualTo(10L);
        assertThat(captor.getValue().getUserId()).isEqualTo(7L);
    }

    @Test
    @DisplayName("topUp - With zero amount - Rejects before locking")
    void topUp_WithZeroAmount_RejectsBeforeLocking() {
        assertThatThrownBy(() -> creditService.topUp(7L, 0L))
            .isInstanceOf(InvalidAmountException.class);

        verifyNoInteractions(walletService, transactionRepository);
    }

    @Test
    @DisplayName("approveBonus - Above single grant limit - Rejects before locking")
    void approveBonus_AboveLimit_RejectsBeforeLocking() {
        assertThatThrownBy(() -> creditService.approveBonus(7L, CreditService.MAX_AMOUNT + 1))
            .isInstanceOf(InvalidAmountException.class)
            .hasMessageContaining("<= 1000000000");

        verifyNoInteractions(walletService, transactionRepository);
    }

    @Test
    @DisplayName("topUp - At single top-up limit - Is accepted")
    void topUp_AtLimit_IsAccepted() {
        Wallet wallet = Wallet.builder().userId(7L).balance(0L).version(0L).build();
        when(walletService.lockForUpdate(7L)).thenReturn(wallet);
        when(walletService.credit(wallet, CreditService.MAX_AMOUNT)).thenReturn(CreditService.MAX_AMOUNT);

        assertThat(creditService.topUp(7L, CreditService.MAX_AMOUNT)).isEqualTo(CreditService.MAX_AMOUNT);
        verify(transactionRepository).save(any(Transaction.class));
    }

    @Test
    @DisplayName("approveBonus - With unknown user - Propagates UserNotFoundException without ledger entry")
    void approveBonus_WithUnknownUser_PropagatesWithoutLedgerEntry() {
        when(walletService.lockForUpdate(404L)).thenThrow(new UserNotFoundException(404L));

        assertThatThrownBy(() -> creditService.approveBonus(404L, 5L))
            .isInstanceOf(UserNotFoundException.class);

        verify(walletService, never()).credit(any(), anyLong());
        verifyNoInteractions(transactionRepository);
    }
}
