package com.fleetgate.gateway.queue;

import com.fleetgate.gateway.agent.SteeringInbox;
import com.fleetgate.store.model.QueueLaneRecord;
import com.fleetgate.store.model.QueueMessage;

import java.util.List;

/**
 * One dispatch of a lane: the messages it covers and their coalesced input.
 */
public record LaneRun(QueueLaneRecord lane, String dispatchId, List<QueueMessage> messages, String input,
        SteeringInbox steering) {

    /** The most recent message; its response context is where the reply goes. */
    public QueueMessage latest() {
        return messages.get(messages.size() - 1);
    }
}
