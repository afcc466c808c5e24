package com.fleetgate.channel.slack;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class SlackConfig {
    private String botToken;
    private String signingSecret;
    /** Bot user id, used to drop our own messages and detect mentions. */
    private String botUserId;
    /** {@code mentions} (default) or {@code all}. */
    private String inboundPolicy = "mentions";
    private List<String> allowedChannels = new ArrayList<>();
    /** Reaction added while a message is being worked on; blank disables it. */
    private String ackReaction = "eyes";
}
