package com.gatehouse.backend.modules.action.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Set algebra over {@link ActionTokenType} bitmasks.
 */
public final class ActionTypeSet {

    /** Every known flag. */
    public static final int ALL = of(ActionTokenType.values());

    /** Actions that only make sense for a principal that already exists. */
    public static final int REQUIRES_EXISTING_PRINCIPAL = of(
            ActionTokenType.VALIDATE_EMAIL,
            ActionTokenType.ACCEPT_TERMS,
            ActionTokenType.ACCEPT_PRIVACY_POLICY,
            ActionTokenType.CREATE_PASSWORD,
            ActionTokenType.RESET_PASSWORD,
            ActionTokenType.CHANGE_EMAIL
    );

    private ActionTypeSet() {
    }

    public static int of(ActionTokenType... types) {
        int mask = 0;
        for (ActionTokenType type : types) {
            mask |= type.bit();
        }
        return mask;
    }

    public static boolean contains(int mask, ActionTokenType flag) {
        return (mask & flag.bit()) == flag.bit();
    }

    public static boolean containsAll(int mask, int required) {
        return (mask & required) == required;
    }

    public static boolean containsAny(int mask, int required) {
        return (mask & required) != 0;
    }

    public static int union(int mask, ActionTokenType flag) {
        return mask | flag.bit();
    }

    public static int difference(int mask, ActionTokenType flag) {
        return mask & ~flag.bit();
    }

    public static List<ActionTokenType> toList(int mask) {
        List<ActionTokenType> actions = new ArrayList<>();
        for (ActionTokenType type : ActionTokenType.values()) {
            if (contains(mask, type)) {
                actions.add(type);
            }
        }
        return actions;
    }

    /** Non-empty and made only of known flags. */
    public static boolean isValid(int mask) {
        return mask != 0 && (mask & ~ALL) == 0;
    }

    public static boolean requiresExistingPrincipal(int mask) {
        return containsAny(mask, REQUIRES_EXISTING_PRINCIPAL);
    }

    public static String describe(int mask) {
        return toList(mask).stream()
                .map(ActionTokenType::name)
                .collect(Collectors.joining("|"));
    }
}
