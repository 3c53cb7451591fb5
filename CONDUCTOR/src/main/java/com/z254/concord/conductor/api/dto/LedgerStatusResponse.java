package com.z254.concord.conductor.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerStatusResponse {

    private int size;
    private int pending;
    private Integer flushed;
    private String lastFlushFailure;
}
