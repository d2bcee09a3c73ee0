package com.gatehouse.backend.modules.user.application;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.gatehouse.backend.global.error.ProblemException;
import com.gatehouse.backend.modules.user.domain.AppUser;
import com.gatehouse.backend.modules.user.domain.Role;
import com.gatehouse.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Lookup and update of principals on behalf of the token and session logic.
 */
@Service
@Transactional
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final AppUserRepository appUserRepository;
    private final RoleService roleService;
    private final PasswordEncoder passwordEncoder;

    public UserService(AppUserRepository appUserRepository, RoleService roleService, PasswordEncoder passwordEncoder) {
        this.appUserRepository = appUserRepository;
        this.roleService = roleService;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional(readOnly = true)
    public AppUser getById(UUID id) {
        return appUserRepository.findByIdWithRoles(id)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User " + id + " not found"));
    }

    @Transactional(readOnly = true)
    public Optional<AppUser> findById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return appUserRepository.findByIdWithRoles(id);
    }

    @Transactional(readOnly = true)
    public Optional<AppUser> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return appUserRepository.findByEmailIgnoreCase(normalizeEmail(email));
    }

    @Transactional(readOnly = true)
    public boolean exists(String email) {
        return email != null && !email.isBlank() && appUserRepository.existsByEmailIgnoreCase(normalizeEmail(email));
    }

    public AppUser update(UUID id, UserUpdate update) {
        AppUser user = getById(id);
        if (update == null || update.isEmpty()) {
            return user;
        }
        if (update.password() != null) {
            user.setPasswordHash(passwordEncoder.encode(update.password()));
        }
        if (update.enabled() != null) {
            user.setEnabled(update.enabled());
        }
        if (update.emailValidated() != null) {
            user.setEmailValidated(update.emailValidated());
        }
        if (update.acceptedTerms() != null) {
            user.setAcceptedTerms(update.acceptedTerms());
        }
        if (update.acceptedPrivacyPolicy() != null) {
            user.setAcceptedPrivacyPolicy(update.acceptedPrivacyPolicy());
        }
        return appUserRepository.save(user);
    }

    public AppUser create(NewUser request) {
        String email = normalizeEmail(request.email());
        if (email == null) {
            throw ProblemException.invalidRequest("EMAIL_REQUIRED", "An email is required");
        }
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.invalidRequest("USER_ALREADY_EXISTS", "A user with the same email already exists");
        }
        String username = request.username() != null && !request.username().isBlank()
                ? request.username().trim()
                : email;
        if (appUserRepository.existsByUsernameIgnoreCase(username)) {
            throw ProblemException.invalidRequest("USER_ALREADY_EXISTS", "A user with the same username already exists");
        }

        List<Role> roles = roleService.findByNames(request.roles());
        Set<String> found = new HashSet<>(roles.stream().map(Role::getName).toList());
        List<String> missing = request.roles().stream().filter(name -> !found.contains(name)).distinct().toList();
        if (!missing.isEmpty()) {
            throw ProblemException.invalidRequest("ROLE_NOT_FOUND", "Unknown roles: " + String.join(", ", missing));
        }

        AppUser user = new AppUser();
        user.setEmail(email);
        user.setUsername(username);
        if (request.password() != null && !request.password().isBlank()) {
            user.setPasswordHash(passwordEncoder.encode(request.password()));
        }
        user.setEnabled(true);
        user.setEmailValidated(request.emailValidated());
        user.setAcceptedTerms(request.acceptedTerms());
        user.setAcceptedPrivacyPolicy(request.acceptedPrivacyPolicy());
        user.getRoles().addAll(roles);

        AppUser saved = appUserRepository.save(user);
        log.debug("Created user {} with roles {}", saved.getEmail(), saved.getRoleNames());
        return saved;
    }

    public static String normalizeEmail(String email) {
        if (email == null) {
            return null;
        }
        String trimmed = email.trim();
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }
}
