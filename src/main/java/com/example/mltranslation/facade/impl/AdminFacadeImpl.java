package com.example.mltranslation.facade.impl;

import com.example.mltranslation.exception.WalletLockTimeoutException;
import com.example.mltranslation.facade.AdminFacade;
import com.example.mltranslation.facade.dto.AdminTopUpRequest;
import com.example.mltranslation.facade.dto.BalanceResponse;
import com.example.mltranslation.facade.dto.TransactionItemDto;
import com.example.mltranslation.facade.dto.TranslationItemDto;
import com.example.mltranslation.service.CreditService;
import com.example.mltranslation.service.HistoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class AdminFacadeImpl implements AdminFacade {

    private final CreditService creditService;
    private final HistoryService historyService;

    @Override
    public BalanceResponse approveBonus(Long adminId, AdminTopUpRequest request) {
        log.info("Processing bonus approval: adminId={}, userId={}, amount={}",
                adminId, request.getUserId(), request.getAmount());

        long balance;
        try {
            balance = creditService.approveBonus(request.getUserId(), request.getAmount());
        } catch (PessimisticLockingFailureException e) {
            log.error("Wallet lock timeout during bonus approval: userId={}", request.getUserId(), e);
            throw new WalletLockTimeoutException(request.getUserId(), e);
        }

        return BalanceResponse.builder()
                .userId(request.getUserId())
                .balance(balance)
                .build();
    }

    @Override
    public List<TransactionItemDto> searchTransactions(Long userId, LocalDateTime from, LocalDateTime to,
                                                       int offset, int limit) {
        validateRange(from, to);
        log.info("Admin transaction search: userId={}, from={}, to={}, offset={}, limit={}",
                userId, from, to, offset, limit);

        return historyService.searchTransactions(userId, from, to, offset, limit).stream()
                .map(HistoryItemMapper::toDto)
                .toList();
    }

    @Override
    public List<TranslationItemDto> searchTranslations(Long userId, LocalDateTime from, LocalDateTime to,
                                                       int offset, int limit) {
        validateRange(from, to);
        log.info("Admin translation search: userId={}, from={}, to={}, offset={}, limit={}",
                userId, from, to, offset, limit);

        return historyService.searchTranslations(userId, from, to, offset, limit).stream()
                .map(HistoryItemMapper::toDto)
                .toList();
    }

    private static void validateRange(LocalDateTime from, LocalDateTime to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("'from' must not be after 'to'");
        }
    }
}
