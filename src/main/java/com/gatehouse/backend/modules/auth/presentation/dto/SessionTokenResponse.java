package com.gatehouse.backend.modules.auth.presentation.dto;

import com.gatehouse.backend.modules.auth.application.SessionTokens;

public record SessionTokenResponse(String accessToken, long expiresIn) {

    public static SessionTokenResponse from(SessionTokens tokens) {
        return new SessionTokenResponse(tokens.accessToken(), tokens.expiresIn());
    }
}
