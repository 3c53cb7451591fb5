package com.z254.concord.conductor.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a manual phase transition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseTransitionRequest {

    @NotBlank(message = "Target phase is required")
    @Size(max = 64, message = "Phase names are at most 64 characters")
    private String phase;

    /**
     * Required when entering a custom phase for the first time.
     */
    private String instructions;

    private String initiatingAgent;

    private String reason;
}
