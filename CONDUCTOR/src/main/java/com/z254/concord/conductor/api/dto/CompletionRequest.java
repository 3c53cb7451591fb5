package com.z254.concord.conductor.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for recording an agent reply by hand.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRequest {

    @NotBlank(message = "Agent is required")
    private String agent;

    @NotBlank(message = "Content is required")
    private String content;

    /**
     * Target turn, null for the open turn.
     */
    private String turnId;

    /**
     * Record the reply even when it matches no open turn target.
     */
    private boolean recordAnyway;
}
