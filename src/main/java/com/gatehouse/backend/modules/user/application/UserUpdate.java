package com.gatehouse.backend.modules.user.application;

/**
 * Partial update of a principal. {@code null} fields are left untouched.
 */
public record UserUpdate(
        String password,
        Boolean enabled,
        Boolean emailValidated,
        Boolean acceptedTerms,
        Boolean acceptedPrivacyPolicy
) {

    public static UserUpdate empty() {
        return new UserUpdate(null, null, null, null, null);
    }

    public UserUpdate withPassword(String value) {
        return new UserUpdate(value, enabled, emailValidated, acceptedTerms, acceptedPrivacyPolicy);
    }

    public UserUpdate withEnabled(boolean value) {
        return new UserUpdate(password, value, emailValidated, acceptedTerms, acceptedPrivacyPolicy);
    }

    public UserUpdate withEmailValidated(boolean value) {
        return new UserUpdate(password, enabled, value, acceptedTerms, acceptedPrivacyPolicy);
    }

    public UserUpdate withAcceptedTerms(boolean value) {
        return new UserUpdate(password, enabled, emailValidated, value, acceptedPrivacyPolicy);
    }

    public UserUpdate withAcceptedPrivacyPolicy(boolean value) {
        return new UserUpdate(password, enabled, emailValidated, acceptedTerms, value);
    }

    public boolean isEmpty() {
        return password == null && enabled == null && emailValidated == null
                && acceptedTerms == null && acceptedPrivacyPolicy == null;
    }
}
