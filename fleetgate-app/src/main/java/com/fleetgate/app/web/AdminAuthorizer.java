package com.fleetgate.app.web;

import com.fleetgate.common.error.AccessDeniedException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Bearer token check for the admin endpoints. An empty {@code fleetgate.admin-token}
 * leaves them open.
 */
@Component
public class AdminAuthorizer {

    private final String adminToken;

    public AdminAuthorizer(@Value("${fleetgate.admin-token:}") String adminToken) {
        this.adminToken = adminToken;
    }

    public void authorize(HttpServletRequest request) {
        if (adminToken == null || adminToken.isEmpty()) {
            return;
        }
        String provided = extractBearerToken(request);
        if (provided == null || !MessageDigest.isEqual(
                provided.getBytes(StandardCharsets.UTF_8), adminToken.getBytes(StandardCharsets.UTF_8))) {
            throw new AccessDeniedException("Admin token missing or invalid");
        }
    }

    private static String extractBearerToken(HttpServletRequest request) {
        String auth = request.getHeader("Authorization");
        if (auth != null && auth.regionMatches(true, 0, "Bearer ", 0, 7)) {
            String token = auth.substring(7).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}
