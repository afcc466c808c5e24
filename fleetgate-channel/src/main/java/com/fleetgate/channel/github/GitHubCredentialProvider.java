package com.fleetgate.channel.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetgate.channel.credential.CredentialEnvelope;
import com.fleetgate.channel.credential.CredentialMintException;
import com.fleetgate.channel.credential.CredentialProvider;
import com.fleetgate.channel.credential.CredentialRequest;
import com.fleetgate.channel.credential.CredentialSource;
import com.fleetgate.common.config.FleetConfig;
import com.fleetgate.common.error.ConfigurationException;
import com.fleetgate.common.json.JsonMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Mints GitHub App installation tokens for one plugin instance and caches them
 * per installation, repository set and permission set.
 */
@Slf4j
public class GitHubCredentialProvider implements CredentialProvider {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final Supplier<GitHubConfig> configSupplier;
    private final OkHttpClient httpClient;
    private final String apiBaseUrl;
    private final long skewSeconds;
    private final long defaultTtlSeconds;
    private final Clock clock;
    private final Cache<String, CredentialEnvelope> cache = Caffeine.newBuilder()
            .maximumSize(1_000)
            .build();

    public GitHubCredentialProvider(Supplier<GitHubConfig> configSupplier, FleetConfig.CredentialsConfig settings,
            OkHttpClient httpClient, Clock clock) {
        this(configSupplier, httpClient, settings.getGithubApiBaseUrl(), settings.getSkewSeconds(),
                settings.getDefaultTtlSeconds(), clock);
    }

    GitHubCredentialProvider(Supplier<GitHubConfig> configSupplier, OkHttpClient httpClient, String apiBaseUrl,
            long skewSeconds, long defaultTtlSeconds, Clock clock) {
        this.configSupplier = configSupplier;
        this.httpClient = httpClient;
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.skewSeconds = skewSeconds;
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.clock = clock;
    }

    @Override
    public CredentialEnvelope getCredential(CredentialRequest request) {
        String cacheKey = cacheKey(request);
        CredentialEnvelope cached = cache.getIfPresent(cacheKey);
        Instant now = clock.instant();
        if (cached != null && cached.expiresAt().minusSeconds(skewSeconds).isAfter(now)) {
            log.debug("Served GitHub token from cache: installation={} repositories={}",
                    request.getInstallationId(), request.getRepositoryIds());
            return cached.withSource(CredentialSource.CACHE);
        }

        GitHubConfig config = configSupplier.get();
        if (config == null || config.getAppId() == null || config.getPrivateKey() == null) {
            throw new ConfigurationException("GitHub App credentials are not configured");
        }

        CredentialEnvelope minted = mint(request, config, now);
        cache.put(cacheKey, minted);
        log.info("Minted GitHub installation token: installation={} repositories={}",
                request.getInstallationId(), request.getRepositoryIds());
        return minted;
    }

    @Override
    public void invalidate(long installationId) {
        String prefix = installationId + ":";
        cache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
    }

    private CredentialEnvelope mint(CredentialRequest request, GitHubConfig config, Instant now) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (request.getRepositoryIds() != null && !request.getRepositoryIds().isEmpty()) {
            body.put("repository_ids", request.getRepositoryIds());
        }
        if (request.getPermissions() != null) {
            body.put("permissions", request.getPermissions());
        }

        Request httpRequest = new Request.Builder()
                .url(apiBaseUrl + "/app/installations/" + request.getInstallationId() + "/access_tokens")
                .header("Authorization", "Bearer " + GitHubAppJwt.create(config.getAppId(), config.getPrivateKey(), now))
                .header("Accept", "application/vnd.github+json")
                .post(RequestBody.create(JsonMapper.write(body), JSON))
                .build();

        try (Response response = httpClient.newCall(httpRequest).execute()) {
            ResponseBody responseBody = response.body();
            String raw = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                JsonNode error = parseQuietly(raw);
                String message = error != null && error.hasNonNull("message") ? error.get("message").asText() : raw;
                String documentationUrl = error != null ? JsonMapper.text(error, "documentation_url") : null;
                log.warn("Failed to mint GitHub token: installation={} repositories={} permissions={} preset={} "
                                + "status={} message={} documentationUrl={} body={}",
                        request.getInstallationId(), request.getRepositoryIds(), request.getPermissions(),
                        config.permissionPreset(), response.code(), message, documentationUrl, raw);
                throw new CredentialMintException(response.code(), message, documentationUrl);
            }

            JsonNode payload = parseQuietly(raw);
            if (payload == null) {
                throw new CredentialMintException(response.code(), "response was not a JSON object", null);
            }
            String token = JsonMapper.text(payload, "token");
            if (token == null) {
                throw new CredentialMintException(response.code(), "response carried no token", null);
            }
            Instant serverExpiry = parseExpiry(JsonMapper.text(payload, "expires_at"), now);
            long ttl = config.getTokenTtlSeconds() != null ? config.getTokenTtlSeconds() : defaultTtlSeconds;
            Instant localExpiry = now.plusSeconds(ttl);
            Instant expiresAt = serverExpiry.isBefore(localExpiry) ? serverExpiry : localExpiry;
            return new CredentialEnvelope(token, expiresAt, CredentialSource.MINT);
        } catch (IOException e) {
            throw new CredentialMintException("GitHub token request failed: " + e.getMessage(), e);
        }
    }

    private Instant parseExpiry(String expiresAt, Instant now) {
        if (expiresAt == null) {
            return now.plusSeconds(defaultTtlSeconds);
        }
        try {
            return Instant.parse(expiresAt);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable GitHub token expiry '{}', using default TTL", expiresAt);
            return now.plusSeconds(defaultTtlSeconds);
        }
    }

    private static JsonNode parseQuietly(String raw) {
        try {
            JsonNode node = JsonMapper.read(raw);
            return node.isObject() ? node : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static String cacheKey(CredentialRequest request) {
        String repoKey = "all";
        if (request.getRepositoryIds() != null && !request.getRepositoryIds().isEmpty()) {
            List<Long> sorted = new ArrayList<>(request.getRepositoryIds());
            sorted.sort(null);
            repoKey = sorted.stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        String permissionsKey = request.getPermissions() != null
                ? JsonMapper.write(new TreeMap<>(request.getPermissions()))
                : "default";
        return request.getInstallationId() + ":" + repoKey + ":" + permissionsKey;
    }
}
