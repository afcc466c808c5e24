package com.fleetgate.channel.credential;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Scope of a requested installation token. Null repositories mean every
 * repository of the installation; null permissions mean the app defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialRequest {
    private long installationId;
    private List<Long> repositoryIds;
    private Map<String, String> permissions;
}
