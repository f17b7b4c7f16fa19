package com.example.mltranslation.service;

import com.example.mltranslation.repository.WalletLedgerMismatch;

import java.util.List;

/**
 * 帳本對帳
 *
 * 找出餘額與帳本加總（TOPUP - DEBIT）不一致的錢包；唯讀，不做任何修正。
 */
public interface ReconciliationService {

    List<WalletLedgerMismatch> findMismatches();
}
