package com.z254.concord.conductor.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response object from completions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMResponse {

    private String id;
    private String model;
    private String providerId;

    /**
     * Generated content.
     */
    private String content;

    private FinishReason finishReason;
    private int inputTokens;
    private int outputTokens;

    /**
     * Generation latency in milliseconds.
     */
    private Long latencyMs;

    /**
     * Reasons for completion finish.
     */
    public enum FinishReason {
        STOP,           // Natural completion
        LENGTH,         // Hit max tokens
        CONTENT_FILTER, // Blocked by content filter
        ERROR           // Error occurred
    }

    public int getTotalTokens() {
        return inputTokens + outputTokens;
    }
}
