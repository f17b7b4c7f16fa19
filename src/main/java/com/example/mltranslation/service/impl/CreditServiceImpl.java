package com.example.mltranslation.service.impl;

import com.example.mltranslation.entity.Transaction;
import com.example.mltranslation.entity.Wallet;
import com.example.mltranslation.exception.InvalidAmountException;
import com.example.mltranslation.repository.TransactionRepository;
import com.example.mltranslation.service.CreditService;
import com.example.mltranslation.service.WalletService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CreditServiceImpl implements CreditService {

    private final WalletService walletService;
    private final TransactionRepository transactionRepository;

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public long approveBonus(Long userId, long amount) {
        long balance = credit(userId, amount);
        log.info("Bonus approved: userId={}, amount={}, balance={}", userId, amount, balance);
        return balance;
    }

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public long topUp(Long userId, long amount) {
        long balance = credit(userId, amount);
        log.info("Wallet topped up: userId={}, amount={}, balance={}", userId, amount, balance);
        return balance;
    }

    private long credit(Long userId, long amount) {
        // 先驗證金額，避免無效請求取得錢包鎖
        if (amount <= 0) {
            throw new InvalidAmountException(amount);
        }
        if (amount > MAX_AMOUNT) {
            throw new InvalidAmountException(String.format("Amount must be <= %d: %d", MAX_AMOUNT, amount), amount);
        }

        Wallet wallet = walletService.lockForUpdate(userId);
        long balance = walletService.credit(wallet, amount);
        transactionRepository.save(Transaction.topUp(userId, amount));
        return balance;
    }
}
