package com.fleetgate.channel.github;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-instance GitHub App configuration.
 */
@Data
public class GitHubConfig {
    private String appId;
    /** PEM, PKCS#1 or PKCS#8. */
    private String privateKey;
    private String webhookSecret;
    /** Handle a comment must mention under the {@code mentions} comment policy. */
    private String mentionHandle = "@fleetgate";
    /** {@code mentions} (default) or {@code all}. */
    private String commentPolicy = "mentions";
    /** {@code owner/repo} names; empty means every repository. */
    private List<String> allowedRepos = new ArrayList<>();
    /** Overrides the default installation token lifetime. */
    private Integer tokenTtlSeconds;
    private Permissions permissions;

    @Data
    public static class Permissions {
        private String preset;
    }

    public String permissionPreset() {
        return permissions != null ? permissions.getPreset() : null;
    }
}
