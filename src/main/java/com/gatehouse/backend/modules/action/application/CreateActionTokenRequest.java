package com.gatehouse.backend.modules.action.application;

import java.util.List;
import java.util.UUID;

/**
 * @param type      action mask, see {@link com.gatehouse.backend.modules.action.domain.ActionTypeSet}
 * @param expiresIn validity in hours, {@code null} for a token that never expires by time
 */
public record CreateActionTokenRequest(
        int type,
        String email,
        UUID userId,
        List<String> roles,
        Integer expiresIn
) {

    public CreateActionTokenRequest {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
