package com.gatehouse.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class AuthConfigValidatorTest {

    private static final String STRONG_SECRET = "0123456789abcdef0123456789abcdef-strong";

    @Test
    void acceptsStrongSecretAndPositiveExpiration() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("jwt.secret", STRONG_SECRET)
                .withProperty("jwt.expiration", "15m");

        assertThat(new AuthConfigValidator(environment).validate()).isEmpty();
    }

    @Test
    void rejectsMissingOrShortSecret() {
        assertThat(new AuthConfigValidator(new MockEnvironment()).validate())
                .containsExactly("jwt.secret is required");
        assertThat(new AuthConfigValidator(new MockEnvironment().withProperty("jwt.secret", "short")).validate())
                .containsExactly("jwt.secret must be at least 32 bytes");
    }

    @Test
    void placeholderSecretIsOnlyRejectedInProduction() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("jwt.secret", AuthConfigValidator.PLACEHOLDER_SECRET);
        assertThat(new AuthConfigValidator(environment).validate()).isEmpty();

        environment.setActiveProfiles("prod");
        assertThat(new AuthConfigValidator(environment).validate())
                .containsExactly("jwt.secret still holds the placeholder value");
    }

    @Test
    void rejectsUnusableExpiration() {
        MockEnvironment zero = new MockEnvironment()
                .withProperty("jwt.secret", STRONG_SECRET)
                .withProperty("jwt.expiration", "0s");
        MockEnvironment garbage = new MockEnvironment()
                .withProperty("jwt.secret", STRONG_SECRET)
                .withProperty("jwt.expiration", "soon");

        assertThat(new AuthConfigValidator(zero).validate()).containsExactly("jwt.expiration must be positive");
        assertThat(new AuthConfigValidator(garbage).validate())
                .containsExactly("jwt.expiration must be a duration such as 15m or 1h");
    }

    @Test
    void startupFailsOnInvalidConfiguration() {
        AuthConfigValidator validator = new AuthConfigValidator(new MockEnvironment());

        assertThatThrownBy(validator::validateOnStartup)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.secret is required");
    }
}
