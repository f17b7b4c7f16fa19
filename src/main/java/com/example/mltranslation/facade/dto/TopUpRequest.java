package com.example.mltranslation.facade.dto;

import com.example.mltranslation.service.CreditService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopUpRequest {
    /**
     * 加值金額
     * 要求：非空，0 < amount <= CreditService.MAX_AMOUNT
     */
    @NotNull(message = "Amount cannot be null")
    @Positive(message = "Amount must be greater than 0")
    @Max(value = CreditService.MAX_AMOUNT, message = "Amount must be <= 1000000000")
    private Long amount;
}
