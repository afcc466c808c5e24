package com.fleetgate.channel.discord;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DiscordConfig {
    private String applicationId;
    /** Hex-encoded Ed25519 application public key. */
    private String publicKey;
    private String botToken;
    private List<String> allowedChannelIds = new ArrayList<>();
}
