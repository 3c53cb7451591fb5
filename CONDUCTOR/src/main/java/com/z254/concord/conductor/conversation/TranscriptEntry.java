package com.z254.concord.conductor.conversation;

/**
 * One role-tagged line of a rendered transcript.
 */
public record TranscriptEntry(String role, String content) {

    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_USER = "user";

    public static TranscriptEntry assistant(String content) {
        return new TranscriptEntry(ROLE_ASSISTANT, content);
    }

    public static TranscriptEntry user(String content) {
        return new TranscriptEntry(ROLE_USER, content);
    }
}
