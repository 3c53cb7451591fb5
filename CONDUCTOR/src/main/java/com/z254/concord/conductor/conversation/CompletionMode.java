package com.z254.concord.conductor.conversation;

/**
 * How a reply that does not match the open turn's targets is treated.
 */
public enum CompletionMode {

    /**
     * Reject replies from untargeted agents or for closed turns as orphaned.
     */
    STRICT,

    /**
     * Record such replies on the matching turn, flagged as forced, without closing anything.
     */
    RECORD_ANYWAY
}
