package com.gatehouse.backend.modules.action.application;

public record ValidateActionTokenRequest(String token, String email, int requiredActions) {
}
