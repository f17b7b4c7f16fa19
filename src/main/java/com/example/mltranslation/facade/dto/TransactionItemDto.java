package com.example.mltranslation.facade.dto;

import com.example.mltranslation.entity.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionItemDto {
    private Long id;
    private Long userId;
    private long amount;
    private TransactionType type;
    private LocalDateTime createdAt;
}
