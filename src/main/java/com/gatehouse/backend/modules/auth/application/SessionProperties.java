package com.gatehouse.backend.modules.auth.application;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Session cookie and session-record policy, bound from {@code gatehouse.session.*}.
 *
 * @param cookieName     name of the cookie mirroring the session token
 * @param cookieSecure   whether the cookie is restricted to HTTPS
 * @param cookieSameSite {@code Strict} or {@code Lax}
 * @param singlePerUser  whether signing in drops the user's other sessions
 */
@ConfigurationProperties(prefix = "gatehouse.session")
public record SessionProperties(
        String cookieName,
        Boolean cookieSecure,
        String cookieSameSite,
        Boolean singlePerUser
) {

    public static final String DEFAULT_COOKIE_NAME = "access_token";

    public SessionProperties {
        if (cookieName == null || cookieName.isBlank()) {
            cookieName = DEFAULT_COOKIE_NAME;
        }
        if (cookieSecure == null) {
            cookieSecure = false;
        }
        if (cookieSameSite == null || cookieSameSite.isBlank()) {
            cookieSameSite = "Strict";
        }
        if (singlePerUser == null) {
            singlePerUser = true;
        }
    }

    public static SessionProperties defaults() {
        return new SessionProperties(null, null, null, null);
    }
}
