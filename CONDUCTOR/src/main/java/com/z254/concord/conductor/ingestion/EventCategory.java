package com.z254.concord.conductor.ingestion;

/**
 * What an inbound event means to the conductor.
 */
public enum EventCategory {

    /** Conversation traffic: user requests and agent chatter outside a routing turn. */
    MESSAGE,

    /** An agent's reply to a routing turn. */
    COMPLETION,

    /** Agent status report. */
    STATUS,

    /** Lessons, reports and other records attached to a conversation. */
    AUXILIARY,

    /** Marked processed, never dispatched. */
    IGNORED
}
