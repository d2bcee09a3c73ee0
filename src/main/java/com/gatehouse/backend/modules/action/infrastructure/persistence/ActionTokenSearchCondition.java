package com.gatehouse.backend.modules.action.infrastructure.persistence;

import java.util.UUID;

/**
 * Filters for listing action tokens. Every field is optional; {@code requiredActions} matches
 * tokens whose mask contains all of the given flags.
 */
public record ActionTokenSearchCondition(
        Integer requiredActions,
        String email,
        UUID userId,
        String roleName
) {

    public static ActionTokenSearchCondition any() {
        return new ActionTokenSearchCondition(null, null, null, null);
    }
}
