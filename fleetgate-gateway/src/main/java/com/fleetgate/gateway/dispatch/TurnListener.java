package com.fleetgate.gateway.dispatch;

/**
 * Follow-on work after an agent reply has been posted (handoffs, relays).
 */
@FunctionalInterface
public interface TurnListener {

    void onReplyPosted(CompletedTurn turn);
}
