package com.fleetgate.channel.adapter;

import java.util.List;

/**
 * Result of validating a plugin instance configuration.
 */
public record ConfigValidation(boolean valid, List<String> errors) {

    public static ConfigValidation ok() {
        return new ConfigValidation(true, List.of());
    }

    public static ConfigValidation invalid(List<String> errors) {
        return new ConfigValidation(false, List.copyOf(errors));
    }

    public static ConfigValidation of(List<String> errors) {
        return errors.isEmpty() ? ok() : invalid(errors);
    }
}
