package com.gatehouse.backend.modules.action.application;

/**
 * Token presented back by the user, with whatever the required actions need.
 */
public record ActionTokenSubmission(
        String token,
        String email,
        String password,
        Boolean acceptedTerms,
        Boolean acceptedPrivacyPolicy
) {

    public static ActionTokenSubmission of(String token, String email) {
        return new ActionTokenSubmission(token, email, null, null, null);
    }
}
