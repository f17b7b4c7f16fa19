package com.example.mltranslation.controller;

import com.example.mltranslation.facade.WalletFacade;
import com.example.mltranslation.facade.dto.BalanceResponse;
import com.example.mltranslation.facade.dto.TopUpRequest;
import com.example.mltranslation.security.AuthenticatedUser;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/wallet")
@RequiredArgsConstructor
public class WalletController {

    private final WalletFacade walletFacade;

    @GetMapping
    public ResponseEntity<BalanceResponse> getBalance(@AuthenticationPrincipal AuthenticatedUser user) {
        log.info("GET /wallet - userId={}", user.getId());

        return ResponseEntity.ok(walletFacade.getBalance(user.getId()));
    }

    @PostMapping("/topup")
    public ResponseEntity<BalanceResponse> topUp(@AuthenticationPrincipal AuthenticatedUser user,
                                                 @Valid @RequestBody TopUpRequest request) {
        log.info("POST /wallet/topup - userId={}, amount={}", user.getId(), request.getAmount());

        return ResponseEntity.ok(walletFacade.topUp(user.getId(), request));
    }
}
