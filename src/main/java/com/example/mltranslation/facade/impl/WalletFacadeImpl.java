package com.example.mltranslation.facade.impl;

import com.example.mltranslation.exception.WalletLockTimeoutException;
import com.example.mltranslation.facade.WalletFacade;
import com.example.mltranslation.facade.dto.BalanceResponse;
import com.example.mltranslation.facade.dto.TopUpRequest;
import com.example.mltranslation.service.CreditService;
import com.example.mltranslation.service.WalletService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class WalletFacadeImpl implements WalletFacade {

    private final WalletService walletService;
    private final CreditService creditService;

    @Override
    public BalanceResponse getBalance(Long userId) {
        long balance = walletService.getBalance(userId);
        log.info("Balance retrieved: userId={}, balance={}", userId, balance);

        return BalanceResponse.builder()
                .userId(userId)
                .balance(balance)
                .build();
    }

    @Override
    public BalanceResponse topUp(Long userId, TopUpRequest request) {
        log.info("Processing top-up request: userId={}, amount={}", userId, request.getAmount());

        long balance;
        try {
            balance = creditService.topUp(userId, request.getAmount());
        } catch (PessimisticLockingFailureException e) {
            log.error("Wallet lock timeout during top-up: userId={}", userId, e);
            throw new WalletLockTimeoutException(userId, e);
        }

        return BalanceResponse.builder()
                .userId(userId)
                .balance(balance)
                .build();
    }
}
