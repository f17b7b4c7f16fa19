package com.example.mltranslation.repository;

/**
 * {@link WalletRepository#findLedgerMismatches()} 的查詢投影
 */
public interface WalletLedgerMismatch {

    Long getUserId();

    Long getBalance();

    Long getLedgerBalance();
}
