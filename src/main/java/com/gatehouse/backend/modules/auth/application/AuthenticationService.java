package com.gatehouse.backend.modules.auth.application;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.gatehouse.backend.global.error.ProblemException;
import com.gatehouse.backend.global.security.AuthenticatedUser;
import com.gatehouse.backend.global.security.SecurityUtils;
import com.gatehouse.backend.modules.auth.application.JwtTokenService.SessionClaims;
import com.gatehouse.backend.modules.auth.application.JwtTokenService.SignedToken;
import com.gatehouse.backend.modules.auth.domain.UserSession;
import com.gatehouse.backend.modules.auth.infrastructure.web.SessionCookieManager;
import com.gatehouse.backend.modules.user.application.UserService;
import com.gatehouse.backend.modules.user.domain.AppUser;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Password sign-in, session token issuance and token-to-principal resolution.
 *
 * <p>The resolved principal lives in {@link SecurityContextHolder} for the duration of the
 * request.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class AuthenticationService {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);

    static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";

    private final UserService userService;
    private final JwtTokenService jwtTokenService;
    private final UserSessionService userSessionService;
    private final SessionCookieManager sessionCookieManager;
    private final PasswordEncoder passwordEncoder;

    public AuthenticationService(
            UserService userService,
            JwtTokenService jwtTokenService,
            UserSessionService userSessionService,
            SessionCookieManager sessionCookieManager,
            PasswordEncoder passwordEncoder
    ) {
        this.userService = userService;
        this.jwtTokenService = jwtTokenService;
        this.userSessionService = userSessionService;
        this.sessionCookieManager = sessionCookieManager;
        this.passwordEncoder = passwordEncoder;
    }

    public SessionTokens signIn(String email, String password, HttpServletResponse response) {
        Optional<AppUser> user = userService.findByEmail(email);
        if (user.isEmpty()) {
            log.warn("Sign-in rejected for unknown email {}", email);
            throw invalidCredentials();
        }
        return authenticate(user.get(), password, response);
    }

    public SessionTokens authenticate(AppUser user, String password, HttpServletResponse response) {
        if (!user.isEnabled()) {
            log.warn("Sign-in rejected for disabled user {}", user.getEmail());
            throw ProblemException.invalidState("USER_DISABLED", "User account is disabled");
        }
        if (!user.hasPassword() || password == null || !passwordEncoder.matches(password, user.getPasswordHash())) {
            log.warn("Sign-in rejected for {}: bad credentials", user.getEmail());
            throw invalidCredentials();
        }

        SignedToken signed = jwtTokenService.sign(user);
        userSessionService.create(signed.token(), user, signed.expiresAt());

        Duration expiration = jwtTokenService.getExpiration();
        if (response != null) {
            sessionCookieManager.write(response, signed.token(), expiration);
        }
        attach(toPrincipal(user), signed.token());

        log.info("User {} signed in", user.getEmail());
        return new SessionTokens(signed.token(), expiration.toSeconds());
    }

    /**
     * Drops the session behind the presented token, if any, and clears the cookie and the
     * security context. Never fails.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public void logout(HttpServletRequest request, HttpServletResponse response) {
        Optional<String> token = request == null ? Optional.empty() : sessionCookieManager.resolveToken(request);
        if (token.isPresent()) {
            try {
                userSessionService.deleteByToken(token.get());
                log.debug("Session removed on logout");
            } catch (ProblemException ex) {
                log.debug("Logout without a live session: {}", ex.getCode());
            } catch (DataAccessException ex) {
                log.warn("Failed to remove session on logout", ex);
            }
        }
        if (response != null) {
            sessionCookieManager.clear(response);
        }
        SecurityContextHolder.clearContext();
    }

    public SessionClaims verifyToken(String token) {
        return jwtTokenService.verify(token);
    }

    /**
     * Resolves {@code token} to its principal and attaches it to the security context.
     */
    @Transactional(readOnly = true, noRollbackFor = ProblemException.class)
    public AuthenticatedUser loadPrincipalFromToken(String token) {
        SessionClaims claims = jwtTokenService.verify(token);

        UserSession session = userSessionService.findByToken(token)
                .orElseThrow(() -> ProblemException.unauthorized("SESSION_NOT_FOUND", "session not found"));
        if (!userSessionService.isActive(session)) {
            throw ProblemException.unauthorized("SESSION_EXPIRED", "session expired");
        }

        AppUser user = userService.findById(claims.userId())
                .orElseThrow(() -> ProblemException.unauthorized("USER_NOT_FOUND", "user not found"));
        if (!user.isEnabled()) {
            throw ProblemException.unauthorized("USER_DISABLED", "user disabled");
        }

        AuthenticatedUser principal = toPrincipal(user);
        attach(principal, token);
        return principal;
    }

    public AuthenticatedUser getAuthenticatedUser() {
        return SecurityUtils.getCurrentPrincipal();
    }

    public boolean isAuthenticated() {
        return SecurityUtils.findCurrentPrincipal().isPresent();
    }

    public boolean hasAnyRole(Collection<String> roles) {
        AuthenticatedUser principal = getAuthenticatedUser();
        return roles.stream().anyMatch(principal::hasRole);
    }

    public boolean hasAllRoles(Collection<String> roles) {
        AuthenticatedUser principal = getAuthenticatedUser();
        return roles.stream().allMatch(principal::hasRole);
    }

    private static AuthenticatedUser toPrincipal(AppUser user) {
        return new AuthenticatedUser(
                user.getId(),
                user.getEmail(),
                user.getUsername(),
                user.getRoleNames(),
                user.getOrganisationId(),
                user.getEstablishmentId()
        );
    }

    private static void attach(AuthenticatedUser principal, String token) {
        List<SimpleGrantedAuthority> authorities = principal.roles().stream()
                .map(role -> new SimpleGrantedAuthority("ROLE_" + role))
                .toList();
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(new UsernamePasswordAuthenticationToken(principal, token, authorities));
        SecurityContextHolder.setContext(context);
    }

    private static ProblemException invalidCredentials() {
        return ProblemException.unauthorized(INVALID_CREDENTIALS, "invalid credentials");
    }
}
