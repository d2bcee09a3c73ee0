package com.gatehouse.backend.modules.action.domain;

import java.util.Optional;

/**
 * Actions an action token can authorize. Bit values are persisted and must never change.
 * Declaration order is the canonical order used when listing actions.
 */
public enum ActionTokenType {

    INVITE(1, "Invitation", "Join the application"),
    VALIDATE_EMAIL(2, "Email validation", "Validate your email address"),
    ACCEPT_TERMS(4, "Terms of service", "Accept the terms of service"),
    ACCEPT_PRIVACY_POLICY(8, "Privacy policy", "Accept the privacy policy"),
    CREATE_PASSWORD(16, "Password creation", "Create your password"),
    RESET_PASSWORD(32, "Password reset", "Reset your password"),
    CHANGE_EMAIL(64, "Email change", "Change your email address");

    private final int bit;
    private final String title;
    private final String description;

    ActionTokenType(int bit, String title, String description) {
        this.bit = bit;
        this.title = title;
        this.description = description;
    }

    public int bit() {
        return bit;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public static Optional<ActionTokenType> fromBit(int bit) {
        for (ActionTokenType type : values()) {
            if (type.bit == bit) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
