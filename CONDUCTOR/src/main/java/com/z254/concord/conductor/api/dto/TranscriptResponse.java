package com.z254.concord.conductor.api.dto;

import com.z254.concord.conductor.conversation.TranscriptEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO carrying the routing transcript as the routing engine sees it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptResponse {

    private String conversationId;
    private String phase;
    private List<String> validTransitions;
    private List<TranscriptEntry> entries;
    private String text;
}
