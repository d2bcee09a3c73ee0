package com.gatehouse.backend.modules.auth.infrastructure.web;

import java.time.Duration;
import java.util.Optional;

import com.gatehouse.backend.modules.auth.application.SessionProperties;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Mirrors the session token into an HttpOnly cookie and reads it back from requests.
 */
@Component
public class SessionCookieManager {

    static final String BEARER_PREFIX = "Bearer ";

    private final SessionProperties sessionProperties;

    public SessionCookieManager(SessionProperties sessionProperties) {
        this.sessionProperties = sessionProperties;
    }

    public void write(HttpServletResponse response, String token, Duration maxAge) {
        response.addHeader(HttpHeaders.SET_COOKIE, build(token, maxAge).toString());
    }

    public void clear(HttpServletResponse response) {
        response.addHeader(HttpHeaders.SET_COOKIE, build("", Duration.ZERO).toString());
    }

    /**
     * Token from the {@code Authorization: Bearer} header, falling back to the session cookie.
     */
    public Optional<String> resolveToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return Optional.of(token);
            }
        }
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        for (Cookie cookie : cookies) {
            if (sessionProperties.cookieName().equals(cookie.getName())
                    && cookie.getValue() != null
                    && !cookie.getValue().isBlank()) {
                return Optional.of(cookie.getValue());
            }
        }
        return Optional.empty();
    }

    public String getCookieName() {
        return sessionProperties.cookieName();
    }

    private ResponseCookie build(String value, Duration maxAge) {
        return ResponseCookie.from(sessionProperties.cookieName(), value)
                .httpOnly(true)
                .secure(sessionProperties.cookieSecure())
                .sameSite(sessionProperties.cookieSameSite())
                .path("/")
                .maxAge(maxAge)
                .build();
    }
}
