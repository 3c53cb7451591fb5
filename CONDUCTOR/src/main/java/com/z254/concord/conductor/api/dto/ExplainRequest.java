package com.z254.concord.conductor.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExplainRequest {

    @NotBlank(message = "Question is required")
    @Size(max = 4000, message = "Question must be less than 4000 characters")
    private String question;
}
