package com.uptimefleet.common.util;

import com.uptimefleet.common.exception.InvalidServiceConfigException;
import com.uptimefleet.common.model.MonitorType;
import com.uptimefleet.common.model.ServiceConfig;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Boundary checks for a service definition. Rejects rather than guesses.
 */
public final class ServiceConfigValidator {

    private ServiceConfigValidator() {
    }

    public static void validate(ServiceConfig config) {
        if (config == null) {
            throw new InvalidServiceConfigException("Service configuration is required");
        }
        if (isBlank(config.getId())) {
            throw new InvalidServiceConfigException("id is required");
        }
        if (isBlank(config.getName())) {
            throw new InvalidServiceConfigException("name is required");
        }
        if (config.getType() == null) {
            throw new InvalidServiceConfigException("type is required (http or icmp)");
        }
        if (config.getInterval() <= 0) {
            throw new InvalidServiceConfigException("interval must be greater than 0 seconds");
        }
        if (config.getTimeout() <= 0) {
            throw new InvalidServiceConfigException("timeout must be greater than 0 ms");
        }

        if (config.getType() == MonitorType.HTTP) {
            if (isBlank(config.getUrl())) {
                throw new InvalidServiceConfigException("URL is required for HTTP services");
            }
            validateUrl(config.getUrl());
        } else if (config.getType() == MonitorType.ICMP && isBlank(config.getHost())) {
            throw new InvalidServiceConfigException("Host is required for ICMP services");
        }
    }

    private static void validateUrl(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                throw new InvalidServiceConfigException("URL must be an absolute http(s) URL: " + url);
            }
        } catch (URISyntaxException e) {
            throw new InvalidServiceConfigException("Malformed URL: " + url);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
