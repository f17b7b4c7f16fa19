package com.example.mltranslation.service.impl;

import com.example.mltranslation.repository.WalletLedgerMismatch;
import com.example.mltranslation.repository.WalletRepository;
import com.example.mltranslation.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class ReconciliationServiceImpl implements ReconciliationService {

    private final WalletRepository walletRepository;

    @Override
    @Transactional(readOnly = true)
    public List<WalletLedgerMismatch> findMismatches() {
        return walletRepository.findLedgerMismatches();
    }
}
