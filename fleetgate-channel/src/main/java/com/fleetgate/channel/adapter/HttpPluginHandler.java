package com.fleetgate.channel.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.store.model.PluginInstance;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Base for handlers that talk to their provider over HTTP with OkHttp.
 */
public abstract class HttpPluginHandler implements PluginHandler {

    protected static final MediaType JSON = MediaType.parse("application/json");

    /** Appended to replies from runs that stopped at their iteration limit. */
    protected static final String LIMIT_NOTICE = "\n\n_(stopped at the iteration limit)_";

    protected final OkHttpClient httpClient;
    protected final String apiBaseUrl;
    protected final Clock clock;

    protected HttpPluginHandler(OkHttpClient httpClient, String apiBaseUrl, Clock clock) {
        this.httpClient = httpClient;
        this.apiBaseUrl = stripTrailingSlash(apiBaseUrl);
        this.clock = clock;
    }

    public static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .build();
    }

    /**
     * Response of a provider API call; {@code body} is an empty object when the response was not JSON.
     */
    protected record ApiResponse(int status, JsonNode body, String raw) {
        public boolean ok() {
            return status >= 200 && status < 300;
        }
    }

    protected ApiResponse postJson(String url, Map<String, String> headers, Object body) throws IOException {
        return sendJson("POST", url, headers, body);
    }

    protected ApiResponse sendJson(String method, String url, Map<String, String> headers, Object body)
            throws IOException {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .method(method, RequestBody.create(JsonMapper.write(body), JSON));
        headers.forEach(builder::header);
        try (Response response = httpClient.newCall(builder.build()).execute()) {
            return toApiResponse(response);
        }
    }

    protected ApiResponse get(String url, Map<String, String> headers) throws IOException {
        Request.Builder builder = new Request.Builder().url(url).get();
        headers.forEach(builder::header);
        try (Response response = httpClient.newCall(builder.build()).execute()) {
            return toApiResponse(response);
        }
    }

    protected <T> T bindConfig(PluginInstance instance, Class<T> type) {
        return JsonMapper.convert(JsonMapper.read(instance.getConfig()), type);
    }

    protected static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        if (trimmed.length() <= max) {
            return trimmed;
        }
        return trimmed.substring(0, max - 3) + "...";
    }

    protected static String withLimitNotice(String content, PostOptions options) {
        if (options != null && options.isHitLimit()) {
            return content + LIMIT_NOTICE;
        }
        return content;
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ApiResponse toApiResponse(Response response) throws IOException {
        ResponseBody responseBody = response.body();
        String raw = responseBody != null ? responseBody.string() : "";
        JsonNode parsed;
        try {
            parsed = JsonMapper.read(raw);
        } catch (IllegalArgumentException e) {
            parsed = JsonMapper.object();
        }
        return new ApiResponse(response.code(), parsed, raw);
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
