package com.gatehouse.backend.modules.auth.application;

/**
 * @param expiresIn seconds until the access token expires
 */
public record SessionTokens(String accessToken, long expiresIn) {
}
