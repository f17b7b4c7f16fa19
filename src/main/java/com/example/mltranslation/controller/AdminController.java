package com.example.mltranslation.controller;

import com.example.mltranslation.facade.AdminFacade;
import com.example.mltranslation.facade.dto.AdminTopUpRequest;
import com.example.mltranslation.facade.dto.BalanceResponse;
import com.example.mltranslation.facade.dto.TransactionItemDto;
import com.example.mltranslation.facade.dto.TranslationItemDto;
import com.example.mltranslation.security.AuthenticatedUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 管理員端點（需 ADMIN 角色，見 SecurityConfig）
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AdminFacade adminFacade;

    @PostMapping("/topup")
    public ResponseEntity<BalanceResponse> approveBonus(@AuthenticationPrincipal AuthenticatedUser admin,
                                                        @Valid @RequestBody AdminTopUpRequest request) {
        log.info("POST /admin/topup - adminId={}, userId={}, amount={}",
                admin.getId(), request.getUserId(), request.getAmount());

        return ResponseEntity.ok(adminFacade.approveBonus(admin.getId(), request));
    }

    @GetMapping("/transactions")
    public ResponseEntity<List<TransactionItemDto>> getTransactions(
            @RequestParam(required = false)
            @Positive(message = "UserId must be positive")
            Long userId,

            @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            LocalDateTime from,

            @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            LocalDateTime to,

            @RequestParam(defaultValue = "0")
            @Min(value = 0, message = "Offset must be >= 0")
            int offset,

            @RequestParam(defaultValue = "100")
            @Min(value = 1, message = "Limit must be >= 1")
            @Max(value = 1000, message = "Limit must be <= 1000")
            int limit) {
        log.info("GET /admin/transactions?userId={}&from={}&to={}&offset={}&limit={}", userId, from, to, offset, limit);

        return ResponseEntity.ok(adminFacade.searchTransactions(userId, from, to, offset, limit));
    }

    @GetMapping("/translations")
    public ResponseEntity<List<TranslationItemDto>> getTranslations(
            @RequestParam(required = false)
            @Positive(message = "UserId must be positive")
            Long userId,

            @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            LocalDateTime from,

            @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            LocalDateTime to,

            @RequestParam(defaultValue = "0")
            @Min(value = 0, message = "Offset must be >= 0")
            int offset,

            @RequestParam(defaultValue = "100")
            @Min(value = 1, message = "Limit must be >= 1")
            @Max(value = 1000, message = "Limit must be <= 1000")
            int limit) {
        log.info("GET /admin/translations?userId={}&from={}&to={}&offset={}&limit={}", userId, from, to, offset, limit);

        return ResponseEntity.ok(adminFacade.searchTranslations(userId, from, to, offset, limit));
    }
}
