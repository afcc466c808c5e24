package com.fleetgate.channel.credential;

import java.util.Locale;

public enum CredentialSource {
    MINT,
    CACHE;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
