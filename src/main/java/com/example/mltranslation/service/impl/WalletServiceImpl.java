package com.example.mltranslation.service.impl;

import com.example.mltranslation.config.RedisCacheConfig;
import com.example.mltranslation.entity.Wallet;
import com.example.mltranslation.event.WalletBalanceChangedEvent;
import com.example.mltranslation.exception.InsufficientFundsException;
import com.example.mltranslation.exception.InvalidAmountException;
import com.example.mltranslation.exception.UserNotFoundException;
import com.example.mltranslation.repository.UserRepository;
import com.example.mltranslation.repository.WalletRepository;
import com.example.mltranslation.service.WalletService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * WalletService 實作類別
 *
 * 實作重點：
 * 1. 延遲建立使用 INSERT ... ON DUPLICATE KEY UPDATE，併發首次存取不會失敗
 * 2. 悲觀鎖（findByUserIdForUpdate）序列化同一使用者的檢查與扣款
 * 3. READ_COMMITTED：upsert 之後重新讀取可看到其他交易已提交的錢包
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WalletServiceImpl implements WalletService {

    private final WalletRepository walletRepository;
    private final UserRepository userRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public Wallet getOrCreate(Long userId) {
        Optional<Wallet> existing = walletRepository.findById(userId);
        if (existing.isPresent()) {
            return existing.get();
        }

        requireUser(userId);
        if (walletRepository.insertIfAbsent(userId) > 0) {
            log.info("Created wallet: userId={}", userId);
        }

        return walletRepository.findById(userId)
            .orElseThrow(() -> new IllegalStateException("Wallet missing after upsert: userId=" + userId));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Wallet lockForUpdate(Long userId) {
        // 1. 一般情況：錢包已存在，直接鎖定
        Optional<Wallet> locked = walletRepository.findByUserIdForUpdate(userId);
        if (locked.isPresent()) {
            return locked.get();
        }

        // 2. 首次存取：建立後再鎖定
        requireUser(userId);
        if (walletRepository.insertIfAbsent(userId) > 0) {
            log.info("Created wallet: userId={}", userId);
        }

        return walletRepository.findByUserIdForUpdate(userId)
            .orElseThrow(() -> new IllegalStateException("Wallet missing after upsert: userId=" + userId));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public long credit(Wallet wallet, long amount) {
        requirePositive(amount);

        long before = wallet.getBalance();
        long after;
        try {
            after = Math.addExact(before, amount);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException(
                String.format("Balance would overflow: userId=%d, balance=%d, amount=%d", wallet.getUserId(), before, amount),
                amount);
        }
        wallet.setBalance(after);
        walletRepository.save(wallet);

        // 交易提交後清除快取
        eventPublisher.publishEvent(new WalletBalanceChangedEvent(this, wallet.getUserId(), before, after));
        log.debug("Credited wallet: userId={}, amount={}, balance={} -> {}", wallet.getUserId(), amount, before, after);
        return after;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public long debit(Wallet wallet, long amount) {
        requirePositive(amount);

        long before = wallet.getBalance();
        if (before < amount) {
            throw new InsufficientFundsException(wallet.getUserId(), before, amount);
        }

        long after = before - amount;
        wallet.setBalance(after);
        walletRepository.save(wallet);

        eventPublisher.publishEvent(new WalletBalanceChangedEvent(this, wallet.getUserId(), before, after));
        log.debug("Debited wallet: userId={}, amount={}, balance={} -> {}", wallet.getUserId(), amount, before, after);
        return after;
    }

    @Override
    @Cacheable(value = RedisCacheConfig.BALANCE_CACHE, key = "#userId")
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public long getBalance(Long userId) {
        return getOrCreate(userId).getBalance();
    }

    @Override
    @CacheEvict(value = RedisCacheConfig.BALANCE_CACHE, key = "#userId")
    public void evictBalanceCache(Long userId) {
        log.debug("evict balance cache, userId: {}", userId);
    }

    private void requireUser(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new InvalidAmountException(amount);
        }
    }
}
