package com.fleetgate.channel.adapter;

import java.util.Locale;

/**
 * Who authored an inbound turn.
 */
public enum ActorKind {
    HUMAN,
    AGENT,
    BOT,
    SYSTEM;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or missing kinds are treated as human. */
    public static ActorKind parse(String raw) {
        if (raw == null) {
            return HUMAN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "agent" -> AGENT;
            case "bot" -> BOT;
            case "system" -> SYSTEM;
            default -> HUMAN;
        };
    }
}
