package com.z254.concord.conductor.api.dto;

import com.z254.concord.conductor.conversation.CompletionOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionResponse {

    private String conversationId;
    private String agent;
    private CompletionOutcome outcome;
}
