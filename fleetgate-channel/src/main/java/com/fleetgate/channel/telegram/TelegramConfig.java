package com.fleetgate.channel.telegram;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-instance Telegram configuration.
 */
@Data
public class TelegramConfig {
    private String botToken;
    /** Value Telegram echoes in X-Telegram-Bot-Api-Secret-Token. */
    private String webhookSecret;
    /** Empty means every chat. */
    private List<String> allowedChatIds = new ArrayList<>();
}
