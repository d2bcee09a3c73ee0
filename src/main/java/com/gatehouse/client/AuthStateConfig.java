package com.gatehouse.client;

import java.net.CookieStore;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Client configuration. Only the base URL is required.
 */
public final class AuthStateConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_COOKIE_NAME = "access_token";

    private final String baseUrl;
    private final String clientId;
    private final Duration timeout;
    private final Map<String, String> headers;
    private final String cookieName;
    private final AuthStorage storage;
    private final CookieStore cookieStore;

    private AuthStateConfig(Builder builder) {
        if (builder.baseUrl == null || builder.baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        String trimmed = builder.baseUrl.trim();
        this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        this.clientId = builder.clientId;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        Map<String, String> merged = new LinkedHashMap<>();
        merged.put("Content-Type", "application/json");
        merged.putAll(builder.headers);
        this.headers = Collections.unmodifiableMap(merged);
        this.cookieName = builder.cookieName != null && !builder.cookieName.isBlank()
                ? builder.cookieName
                : DEFAULT_COOKIE_NAME;
        this.storage = builder.storage;
        this.cookieStore = builder.cookieStore;
    }

    public static Builder builder(String baseUrl) {
        return new Builder().baseUrl(baseUrl);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getClientId() {
        return clientId;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getCookieName() {
        return cookieName;
    }

    public AuthStorage getStorage() {
        return storage;
    }

    public CookieStore getCookieStore() {
        return cookieStore;
    }

    public static final class Builder {

        private String baseUrl;
        private String clientId;
        private Duration timeout;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String cookieName;
        private AuthStorage storage;
        private CookieStore cookieStore;

        private Builder() {
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder cookieName(String cookieName) {
            this.cookieName = cookieName;
            return this;
        }

        public Builder storage(AuthStorage storage) {
            this.storage = storage;
            return this;
        }

        public Builder cookieStore(CookieStore cookieStore) {
            this.cookieStore = cookieStore;
            return this;
        }

        public AuthStateConfig build() {
            return new AuthStateConfig(this);
        }
    }
}
