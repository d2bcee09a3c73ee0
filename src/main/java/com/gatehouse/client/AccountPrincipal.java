package com.gatehouse.client;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Account returned by {@code GET /auth/account}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountPrincipal(String id, String email, String username, List<String> roles) {

    public AccountPrincipal {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
