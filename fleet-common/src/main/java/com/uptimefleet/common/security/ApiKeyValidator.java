package com.uptimefleet.common.security;

import com.uptimefleet.common.constants.FleetConstants;
import com.uptimefleet.common.exception.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Shared bearer-token check for node-to-node calls.
 * With no key configured every request is rejected.
 */
@Slf4j
public class ApiKeyValidator {

    private final byte[] expectedKey;

    public ApiKeyValidator(String apiKey) {
        this.expectedKey = apiKey == null || apiKey.isEmpty()
                ? null
                : apiKey.getBytes(StandardCharsets.UTF_8);
        if (expectedKey == null) {
            log.warn("No API key configured: all authenticated endpoints will answer 401");
        }
    }

    public boolean isConfigured() {
        return expectedKey != null;
    }

    /**
     * Validate an Authorization header value, throwing UnauthorizedException when it does not match
     */
    public void validate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(FleetConstants.BEARER_PREFIX)) {
            throw new UnauthorizedException("Missing or invalid Authorization header");
        }
        if (expectedKey == null) {
            throw new UnauthorizedException("API key not configured");
        }
        String token = authorizationHeader.substring(FleetConstants.BEARER_PREFIX.length()).trim();
        if (!MessageDigest.isEqual(expectedKey, token.getBytes(StandardCharsets.UTF_8))) {
            throw new UnauthorizedException("Invalid API key");
        }
    }

    public boolean isValid(String authorizationHeader) {
        try {
            validate(authorizationHeader);
            return true;
        } catch (UnauthorizedException e) {
            log.debug("Rejected credentials: {}", e.getMessage());
            return false;
        }
    }

    public static String bearer(String apiKey) {
        return FleetConstants.BEARER_PREFIX + (apiKey != null ? apiKey : "");
    }
}
