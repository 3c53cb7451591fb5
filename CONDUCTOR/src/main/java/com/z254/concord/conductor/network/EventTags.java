package com.z254.concord.conductor.network;

import java.util.List;

/**
 * Tag names and helpers. A tag is a list whose first element is the name.
 */
public final class EventTags {

    /** Conversation root event id. */
    public static final String CONVERSATION = "e";
    /** Recipient public key. */
    public static final String RECIPIENT = "p";
    public static final String TURN = "turn";
    public static final String PHASE = "phase";
    public static final String STATUS = "status";
    public static final String TITLE = "title";
    /** Auxiliary record type, e.g. lesson or report. */
    public static final String RECORD_TYPE = "t";

    public static final String STATUS_COMPLETED = "completed";

    private EventTags() {
    }

    public static List<String> tag(String name, String value) {
        return List.of(name, value);
    }
}
