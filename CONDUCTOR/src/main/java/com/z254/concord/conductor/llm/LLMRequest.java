package com.z254.concord.conductor.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request object for completions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMRequest {

    /**
     * Model to use for completion. Null means the provider default.
     */
    private String model;

    /**
     * Messages for the conversation.
     */
    private List<Message> messages;

    /**
     * Temperature for sampling (0.0 - 2.0).
     */
    @Builder.Default
    private Double temperature = 0.7;

    /**
     * Maximum tokens to generate.
     */
    private Integer maxTokens;

    /**
     * Response format.
     */
    @Builder.Default
    private ResponseFormat responseFormat = ResponseFormat.TEXT;

    public enum ResponseFormat {
        TEXT("text"),
        JSON_OBJECT("json_object");

        private final String wireName;

        ResponseFormat(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }
    }

    /**
     * A message in the conversation.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String role;  // system, user, assistant
        private String content;
    }

    // Factory methods for common message types

    public static Message systemMessage(String content) {
        return Message.builder()
                .role("system")
                .content(content)
                .build();
    }

    public static Message userMessage(String content) {
        return Message.builder()
                .role("user")
                .content(content)
                .build();
    }

    public static Message message(String role, String content) {
        return Message.builder()
                .role(role)
                .content(content)
                .build();
    }
}
