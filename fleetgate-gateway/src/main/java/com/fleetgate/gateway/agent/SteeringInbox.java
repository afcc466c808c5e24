package com.fleetgate.gateway.agent;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.common.json.JsonMapper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Mid-run input for an active agent run. Runners drain it between iterations; each
 * offer is also announced through the run's {@code onEvent} callback.
 * <p>
 * The inbox is closed once the agent has returned. Closed inboxes refuse offers, and
 * whatever the runner never drained can be taken back with {@link #reclaim()}.
 */
public class SteeringInbox {

    public record SteeringMessage(String messageId, String workItemId, String senderName, String text,
            long arrivedAt) {
    }

    private final Deque<SteeringMessage> messages = new ArrayDeque<>();
    private final List<SteeringMessage> consumed = new ArrayList<>();
    private boolean closed;
    private volatile Consumer<AgentEvent> listener;

    public void onOffer(Consumer<AgentEvent> listener) {
        this.listener = listener;
    }

    /**
     * @return false when the run already finished; the caller keeps the message
     */
    public boolean offer(SteeringMessage message) {
        synchronized (this) {
            if (closed) {
                return false;
            }
            messages.addLast(message);
        }
        Consumer<AgentEvent> current = listener;
        if (current != null) {
            ObjectNode data = JsonMapper.object();
            data.put("messageId", message.messageId());
            data.put("workItemId", message.workItemId());
            data.put("senderName", message.senderName());
            data.put("text", message.text());
            current.accept(new AgentEvent(AgentEvent.STEER, data));
        }
        return true;
    }

    /** Remove and return everything offered so far. */
    public synchronized List<SteeringMessage> drain() {
        List<SteeringMessage> drained = new ArrayList<>(messages);
        messages.clear();
        consumed.addAll(drained);
        return drained;
    }

    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /** Everything the runner has drained. */
    public synchronized List<SteeringMessage> consumed() {
        return List.copyOf(consumed);
    }

    /** Offered but not yet drained. */
    public synchronized List<SteeringMessage> unread() {
        return List.copyOf(messages);
    }

    /**
     * Close the inbox and hand back the messages the runner never drained.
     */
    public synchronized List<SteeringMessage> reclaim() {
        closed = true;
        List<SteeringMessage> unread = new ArrayList<>(messages);
        messages.clear();
        return unread;
    }

    public synchronized int size() {
        return messages.size();
    }
}
