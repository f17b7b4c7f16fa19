package com.example.mltranslation.facade.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaginationMeta {
    private long offset;
    private int limit;
    private long totalElements;
    private boolean hasNext;
    private boolean hasPrevious;
}
