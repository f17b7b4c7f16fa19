package com.example.mltranslation.service.impl;

import com.example.mltranslation.entity.Transaction;
import com.example.mltranslation.entity.Translation;
import com.example.mltranslation.repository.OffsetPageRequest;
import com.example.mltranslation.repository.TransactionRepository;
import com.example.mltranslation.repository.TranslationRepository;
import com.example.mltranslation.service.HistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class HistoryServiceImpl implements HistoryService {

    private final TransactionRepository transactionRepository;
    private final TranslationRepository translationRepository;

    @Override
    public List<Translation> listTranslations(Long userId, int offset, int limit) {
        return translationRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId, OffsetPageRequest.of(offset, limit));
    }

    @Override
    public List<Transaction> listTransactions(Long userId, int offset, int limit) {
        return transactionRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId, OffsetPageRequest.of(offset, limit));
    }

    @Override
    public long countTranslations(Long userId) {
        return translationRepository.countByUserId(userId);
    }

    @Override
    public long countTransactions(Long userId) {
        return transactionRepository.countByUserId(userId);
    }

    @Override
    public Optional<Translation> findTaskResult(String taskId, Long userId) {
        return translationRepository.findByExternalIdAndUserId(taskId, userId);
    }

    @Override
    public List<Transaction> searchTransactions(Long userId, LocalDateTime from, LocalDateTime to, int offset, int limit) {
        return transactionRepository.search(userId, from, to, OffsetPageRequest.of(offset, limit));
    }

    @Override
    public List<Translation> searchTranslations(Long userId, LocalDateTime from, LocalDateTime to, int offset, int limit) {
        return translationRepository.search(userId, from, to, OffsetPageRequest.of(offset, limit));
    }
}
