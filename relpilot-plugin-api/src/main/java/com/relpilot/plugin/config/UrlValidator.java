package com.relpilot.plugin.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

/**
 * Checks webhook and API URLs taken from plugin configuration against a required scheme, an
 * optional host allow-list and an optional path prefix. Restricting hosts keeps a plugin from
 * being pointed at internal addresses.
 */
public final class UrlValidator {

    private final String scheme;
    private List<String> allowedHosts = List.of();
    private String pathPrefix = "";

    public UrlValidator(String scheme) {
        this.scheme = scheme != null ? scheme : "";
    }

    /** Host (with port, if any) must equal one of {@code hosts}. */
    public UrlValidator withHosts(String... hosts) {
        this.allowedHosts = List.of(hosts);
        return this;
    }

    public UrlValidator withPathPrefix(String prefix) {
        this.pathPrefix = prefix != null ? prefix : "";
        return this;
    }

    /**
     * @throws IllegalArgumentException describing the first rule the URL breaks
     */
    public void validate(String url) {
        if (url == null || url.isEmpty()) {
            throw new IllegalArgumentException("URL is required");
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid URL format: " + e.getMessage(), e);
        }
        if (!scheme.isEmpty() && !scheme.equals(uri.getScheme())) {
            throw new IllegalArgumentException("URL must use " + scheme + " scheme");
        }
        if (!allowedHosts.isEmpty()) {
            String host = hostWithPort(uri);
            if (!allowedHosts.contains(host)) {
                throw new IllegalArgumentException("URL host " + host + " is not allowed, must be one of: "
                        + String.join(", ", allowedHosts));
            }
        }
        String path = uri.getPath() != null ? uri.getPath() : "";
        if (!pathPrefix.isEmpty() && !path.startsWith(pathPrefix)) {
            throw new IllegalArgumentException("URL path must start with " + pathPrefix);
        }
    }

    /** Boolean form of {@link #validate(String)}. */
    public boolean isValid(String url) {
        try {
            validate(url);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String hostWithPort(URI uri) {
        String host = uri.getHost() != null ? uri.getHost() : "";
        return uri.getPort() >= 0 ? host + ":" + uri.getPort() : host;
    }
}
