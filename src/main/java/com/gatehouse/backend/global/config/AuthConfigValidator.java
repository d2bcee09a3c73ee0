package com.gatehouse.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Refuses to run with a JWT configuration that would issue forgeable or unusable session tokens.
 */
@Component
public class AuthConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(AuthConfigValidator.class);

    static final int MIN_SECRET_BYTES = 32;
    static final String PLACEHOLDER_SECRET = "change-me-change-me-change-me-change-me";

    private final Environment environment;

    public AuthConfigValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateOnStartup() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid auth configuration: {}", problem));
            throw new IllegalStateException("Invalid auth configuration: " + String.join("; ", problems));
        }
        log.info("Auth configuration validated");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        Optional<String> secret = Optional.ofNullable(environment.getProperty("jwt.secret"))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
        if (secret.isEmpty()) {
            problems.add("jwt.secret is required");
        } else if (secret.get().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            problems.add("jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        } else if (secret.get().equals(PLACEHOLDER_SECRET) && isProductionProfile()) {
            problems.add("jwt.secret still holds the placeholder value");
        }

        String expiration = environment.getProperty("jwt.expiration");
        if (expiration != null) {
            try {
                Duration duration = DurationStyle.detectAndParse(expiration.trim());
                if (duration.isNegative() || duration.isZero()) {
                    problems.add("jwt.expiration must be positive");
                }
            } catch (IllegalArgumentException ex) {
                problems.add("jwt.expiration must be a duration such as 15m or 1h");
            }
        }
        return problems;
    }

    private boolean isProductionProfile() {
        for (String profile : environment.getActiveProfiles()) {
            if (profile.equalsIgnoreCase("prod") || profile.equalsIgnoreCase("production")) {
                return true;
            }
        }
        return false;
    }
}
