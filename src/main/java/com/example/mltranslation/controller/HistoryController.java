package com.example.mltranslation.controller;

import com.example.mltranslation.facade.HistoryFacade;
import com.example.mltranslation.facade.dto.HistoryResponse;
import com.example.mltranslation.facade.dto.TransactionItemDto;
import com.example.mltranslation.facade.dto.TranslationItemDto;
import com.example.mltranslation.security.AuthenticatedUser;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Slf4j
@Validated
@RestController
@RequestMapping("/history")
@RequiredArgsConstructor
public class HistoryController {

    private final HistoryFacade historyFacade;

    @GetMapping("/translations")
    public ResponseEntity<HistoryResponse<TranslationItemDto>> getTranslations(
            @AuthenticationPrincipal AuthenticatedUser user,

            @RequestParam(defaultValue = "0")
            @Min(value = 0, message = "Offset must be >= 0")
            int offset,

            @RequestParam(defaultValue = "100")
            @Min(value = 1, message = "Limit must be >= 1")
            @Max(value = 500, message = "Limit must be <= 500")
            int limit) {
        log.info("GET /history/translations?offset={}&limit={} - userId={}", offset, limit, user.getId());

        return ResponseEntity.ok(historyFacade.getTranslations(user.getId(), offset, limit));
    }

    @GetMapping("/transactions")
    public ResponseEntity<HistoryResponse<TransactionItemDto>> getTransactions(
            @AuthenticationPrincipal AuthenticatedUser user,

            @RequestParam(defaultValue = "0")
            @Min(value = 0, message = "Offset must be >= 0")
            int offset,

            @RequestParam(defaultValue = "100")
            @Min(value = 1, message = "Limit must be >= 1")
            @Max(value = 500, message = "Limit must be <= 500")
            int limit) {
        log.info("GET /history/transactions?offset={}&limit={} - userId={}", offset, limit, user.getId());

        return ResponseEntity.ok(historyFacade.getTransactions(user.getId(), offset, limit));
    }
}
