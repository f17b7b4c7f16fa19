package com.example.mltranslation.service.impl;

import com.example.mltranslation.config.TranslationProperties;
import com.example.mltranslation.entity.Transaction;
import com.example.mltranslation.entity.Translation;
import com.example.mltranslation.entity.Wallet;
import com.example.mltranslation.exception.BusinessRuleException;
import com.example.mltranslation.exception.EmptyInputException;
import com.example.mltranslation.exception.ExternalIdConflictException;
import com.example.mltranslation.exception.InsufficientFundsException;
import com.example.mltranslation.exception.InvalidLanguageCodeException;
import com.example.mltranslation.exception.TranslationFailedException;
import com.example.mltranslation.repository.TransactionRepository;
import com.example.mltranslation.repository.TranslationRepository;
import com.example.mltranslation.service.InsufficientFundsPolicy;
import com.example.mltranslation.service.TranslationCommand;
import com.example.mltranslation.service.TranslationOutcome;
import com.example.mltranslation.service.TranslationRequestProcessor;
import com.example.mltranslation.service.WalletService;
import com.example.mltranslation.translator.Translator;
import com.example.mltranslation.validation.LanguageCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * TranslationRequestProcessor 實作類別
 *
 * 實作重點：
 * 1. 單一 READ_COMMITTED 交易包住全部步驟，任何例外皆 rollback
 * 2. 鎖定前後各做一次冪等檢查；鎖內檢查可看到併發重送已提交的結果
 * 3. 翻譯在持有錢包鎖時執行，時間上限由 TimeLimitedTranslator 控制
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TranslationRequestProcessorImpl implements TranslationRequestProcessor {

    private final WalletService walletService;
    private final TransactionRepository transactionRepository;
    private final TranslationRepository translationRepository;
    private final Translator translator;
    private final TranslationProperties properties;

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public TranslationOutcome process(TranslationCommand command, InsufficientFundsPolicy policy) {
        // 1. 正規化與驗證
        Long userId = command.getUserId();
        String inputText = command.getInputText() == null ? "" : command.getInputText().trim();
        if (inputText.isEmpty()) {
            throw new EmptyInputException();
        }
        String sourceLang = requireLanguageCode(command.getSourceLang());
        String targetLang = requireLanguageCode(command.getTargetLang());
        String externalId = command.getExternalId();

        // 2. 冪等檢查
        Optional<TranslationOutcome> replay = findReplay(externalId, userId);
        if (replay.isPresent()) {
            return replay.get();
        }

        // 3. 鎖定錢包（不存在時建立）
        Wallet wallet = walletService.lockForUpdate(userId);

        // 4. 鎖內再次冪等檢查
        replay = findReplay(externalId, userId);
        if (replay.isPresent()) {
            return replay.get();
        }

        // 5. 餘額檢查
        int cost = properties.getCostPerRequest();
        boolean charge = wallet.getBalance() >= cost;
        if (!charge && policy == InsufficientFundsPolicy.STRICT) {
            log.warn("Translation rejected - insufficient funds: userId={}, balance={}, cost={}, externalId={}",
                userId, wallet.getBalance(), cost, externalId);
            throw new InsufficientFundsException(userId, wallet.getBalance(), cost);
        }

        // 6. 翻譯（持有錢包鎖）
        String outputText = translate(inputText, sourceLang, targetLang);

        // 7. 扣款 + 帳本 + 翻譯紀錄
        if (charge) {
            walletService.debit(wallet, cost);
            transactionRepository.save(Transaction.debit(userId, cost));
        } else {
            log.info("Translating without charge (lenient policy): userId={}, balance={}, cost={}",
                userId, wallet.getBalance(), cost);
        }

        Translation translation = translationRepository.save(Translation.builder()
            .userId(userId)
            .externalId(externalId != null ? externalId : UUID.randomUUID().toString())
            .inputText(inputText)
            .outputText(outputText)
            .sourceLang(sourceLang)
            .targetLang(targetLang)
            .cost(charge ? cost : null)
            .build());

        log.info("Translation processed: userId={}, externalId={}, {} -> {}, cost={}",
            userId, translation.getExternalId(), sourceLang, targetLang, translation.getCost());
        return TranslationOutcome.of(translation, false);
    }

    @Override
    @Transactional(readOnly = true, isolation = Isolation.READ_COMMITTED)
    public Optional<TranslationOutcome> findCompleted(String externalId, Long userId) {
        return findReplay(externalId, userId);
    }

    private Optional<TranslationOutcome> findReplay(String externalId, Long userId) {
        if (externalId == null) {
            return Optional.empty();
        }
        Optional<Translation> existing = translationRepository.findByExternalId(externalId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        if (!existing.get().getUserId().equals(userId)) {
            throw new ExternalIdConflictException(externalId);
        }
        log.info("Replaying completed translation: userId={}, externalId={}", userId, externalId);
        return Optional.of(TranslationOutcome.of(existing.get(), true));
    }

    private String translate(String text, String sourceLang, String targetLang) {
        try {
            return translator.translate(text, sourceLang, targetLang);
        } catch (BusinessRuleException | TranslationFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TranslationFailedException("Translator failed: " + e.getMessage(), e);
        }
    }

    private static String requireLanguageCode(String languageCode) {
        if (!LanguageCodes.isWellFormed(languageCode)) {
            throw new InvalidLanguageCodeException(languageCode);
        }
        return LanguageCodes.normalize(languageCode);
    }
}
