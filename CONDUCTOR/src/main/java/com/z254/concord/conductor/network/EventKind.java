package com.z254.concord.conductor.network;

import java.util.Arrays;
import java.util.Optional;

/**
 * Event kinds understood by the conductor.
 */
public enum EventKind {

    TEXT_NOTE(1),
    CONVERSATION_ROOT(11),
    GENERIC_REPLY(1111),
    AUXILIARY_RECORD(4129),
    AGENT_STATUS(24010),
    TYPING_START(24111),
    TYPING_STOP(24112);

    private final int code;

    EventKind(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isConversational() {
        return this == TEXT_NOTE || this == CONVERSATION_ROOT || this == GENERIC_REPLY;
    }

    public boolean isTypingIndicator() {
        return this == TYPING_START || this == TYPING_STOP;
    }

    public static Optional<EventKind> of(int code) {
        return Arrays.stream(values())
                .filter(kind -> kind.code == code)
                .findFirst();
    }
}
