package com.gatehouse.backend.modules.action.application;

import java.util.List;
import java.util.Optional;

import com.gatehouse.backend.modules.action.domain.ActionTokenType;
import com.gatehouse.backend.modules.action.domain.ActionTypeSet;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-action validity and frontend route, bound from {@code gatehouse.actions.*}:
 *
 * <pre>
 * gatehouse:
 *   actions:
 *     invite:
 *       validity: 72
 *       route: auth/accept-invitation
 *     reset-password:
 *       validity: 2
 *       route: auth/reset-password
 *     default-roles: [member]
 * </pre>
 *
 * @param defaultRoles roles granted to invited users when the invitation names none
 */
@ConfigurationProperties(prefix = "gatehouse.actions")
public record ActionProperties(
        ActionSettings invite,
        ActionSettings validateEmail,
        ActionSettings acceptTerms,
        ActionSettings acceptPrivacyPolicy,
        ActionSettings createPassword,
        ActionSettings resetPassword,
        ActionSettings changeEmail,
        List<String> defaultRoles
) {

    public static final int DEFAULT_VALIDITY_HOURS = 24;

    public ActionProperties {
        invite = invite == null ? ActionSettings.defaults() : invite;
        validateEmail = validateEmail == null ? ActionSettings.defaults() : validateEmail;
        acceptTerms = acceptTerms == null ? ActionSettings.defaults() : acceptTerms;
        acceptPrivacyPolicy = acceptPrivacyPolicy == null ? ActionSettings.defaults() : acceptPrivacyPolicy;
        createPassword = createPassword == null ? ActionSettings.defaults() : createPassword;
        resetPassword = resetPassword == null ? ActionSettings.defaults() : resetPassword;
        changeEmail = changeEmail == null ? ActionSettings.defaults() : changeEmail;
        defaultRoles = defaultRoles == null ? List.of() : List.copyOf(defaultRoles);
    }

    public static ActionProperties defaults() {
        return new ActionProperties(null, null, null, null, null, null, null, null);
    }

    public ActionSettings settingsFor(ActionTokenType type) {
        return switch (type) {
            case INVITE -> invite;
            case VALIDATE_EMAIL -> validateEmail;
            case ACCEPT_TERMS -> acceptTerms;
            case ACCEPT_PRIVACY_POLICY -> acceptPrivacyPolicy;
            case CREATE_PASSWORD -> createPassword;
            case RESET_PASSWORD -> resetPassword;
            case CHANGE_EMAIL -> changeEmail;
        };
    }

    /**
     * Longest configured validity among the actions of {@code mask}, or the default when the mask
     * names no action.
     */
    public int maxValidityHours(int mask) {
        return ActionTypeSet.toList(mask).stream()
                .mapToInt(type -> settingsFor(type).validity())
                .max()
                .orElse(DEFAULT_VALIDITY_HOURS);
    }

    /** Frontend route for a single-action mask. Combined masks have no dedicated page. */
    public Optional<String> routeFor(int mask) {
        return ActionTokenType.fromBit(mask)
                .map(this::settingsFor)
                .map(ActionSettings::route)
                .filter(route -> !route.isBlank());
    }

    /**
     * @param validity hours a token stays usable
     * @param route    frontend path, relative to the caller's frontend URL
     */
    public record ActionSettings(Integer validity, String route) {

        public ActionSettings {
            if (validity == null || validity <= 0) {
                validity = DEFAULT_VALIDITY_HOURS;
            }
            route = route == null ? "" : route.trim();
        }

        static ActionSettings defaults() {
            return new ActionSettings(null, null);
        }
    }
}
