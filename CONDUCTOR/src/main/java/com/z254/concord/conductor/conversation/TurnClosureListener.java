package com.z254.concord.conductor.conversation;

import com.z254.concord.conductor.domain.model.RoutingEntry;

/**
 * Notified after a turn leaves the open state, by coverage or by force.
 */
@FunctionalInterface
public interface TurnClosureListener {

    void onTurnClosed(String conversationId, RoutingEntry closedTurn);
}
