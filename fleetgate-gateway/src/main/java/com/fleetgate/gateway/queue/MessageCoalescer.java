package com.fleetgate.gateway.queue;

import com.fleetgate.store.model.QueueMessage;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Folds a batch of queued messages into a single agent input.
 */
public final class MessageCoalescer {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private MessageCoalescer() {
    }

    /**
     * One message passes through unchanged; several become a header line plus one
     * {@code [HH:mm:ss - sender] text} line each.
     */
    public static String coalesce(List<QueueMessage> messages, ZoneId zone) {
        if (messages.isEmpty()) {
            return "";
        }
        if (messages.size() == 1) {
            return messages.get(0).getText();
        }
        StringBuilder out = new StringBuilder()
                .append('[').append(messages.size()).append(" messages arrived while you were working]\n");
        for (QueueMessage message : messages) {
            String sender = message.getSenderName() != null ? message.getSenderName() : "unknown";
            out.append('\n')
                    .append('[')
                    .append(TIME.format(Instant.ofEpochMilli(message.getArrivedAt()).atZone(zone)))
                    .append(" - ")
                    .append(sender)
                    .append("] ")
                    .append(message.getText());
        }
        return out.toString();
    }
}
