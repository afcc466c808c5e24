package com.fleetgate.channel.adapter;

import lombok.Getter;

import java.util.Map;
import java.util.TreeMap;

/**
 * Raw inbound webhook: headers (case-insensitive) and the unparsed body, which
 * signature checks need byte-for-byte.
 */
@Getter
public class WebhookRequest {

    private final Map<String, String> headers;
    private final String body;

    public WebhookRequest(Map<String, String> headers, String body) {
        this.headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            this.headers.putAll(headers);
        }
        this.body = body != null ? body : "";
    }

    /** Header value, or {@code null}. */
    public String header(String name) {
        return headers.get(name);
    }
}
