package com.gatehouse.backend.modules.auth.presentation.dto;

import com.gatehouse.backend.modules.action.application.Registration;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignUpRequest(
        @NotBlank(message = "email is required") @Email String email,
        @Size(max = 100) String username,
        @NotBlank(message = "password is required") String password,
        boolean acceptedTerms,
        boolean acceptedPrivacyPolicy
) {

    public Registration toRegistration() {
        return new Registration(email, username, password, acceptedTerms, acceptedPrivacyPolicy);
    }
}
