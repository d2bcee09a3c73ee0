package com.gatehouse.backend.modules.action.application;

import java.util.List;

/**
 * @param roles     roles granted on acceptance, configured defaults when {@code null}
 * @param expiresIn validity in hours, configured invite validity when {@code null}
 */
public record InvitationRequest(String email, List<String> roles, Integer expiresIn) {
}
