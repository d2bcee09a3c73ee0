package com.gatehouse.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.gatehouse.backend.global.error.ProblemException;
import com.gatehouse.backend.global.error.ProblemKind;
import com.gatehouse.backend.global.security.AuthenticatedUser;
import com.gatehouse.backend.global.security.SecurityUtils;
import com.gatehouse.backend.modules.auth.application.JwtTokenService.SessionClaims;
import com.gatehouse.backend.modules.auth.application.JwtTokenService.SignedToken;
import com.gatehouse.backend.modules.auth.domain.UserSession;
import com.gatehouse.backend.modules.auth.infrastructure.web.SessionCookieManager;
import com.gatehouse.backend.modules.user.application.UserService;
import com.gatehouse.backend.modules.user.domain.AppUser;
import com.gatehouse.backend.support.TestFixtures;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
class AuthenticationServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");
    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000501");

    @Mock
    private UserService userService;

    @Mock
    private JwtTokenService jwtTokenService;

    @Mock
    private UserSessionService userSessionService;

    @Mock
    private PasswordEncoder passwordEncoder;

    private AuthenticationService authenticationService;
    private AppUser alice;

    @BeforeEach
    void setUp() {
        authenticationService = new AuthenticationService(
                userService,
                jwtTokenService,
                userSessionService,
                new SessionCookieManager(SessionProperties.defaults()),
                passwordEncoder
        );
        alice = TestFixtures.user(USER_ID, "alice@example.com", "member");
        alice.setPasswordHash("$2a$hash");
        lenient().when(jwtTokenService.getExpiration()).thenReturn(Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("sign-in opens a session, sets the cookie and attaches the principal")
    void signInOpensSession() {
        when(userService.findByEmail("alice@example.com")).thenReturn(Optional.of(alice));
        when(passwordEncoder.matches("secret", "$2a$hash")).thenReturn(true);
        when(jwtTokenService.sign(alice)).thenReturn(new SignedToken("jwt", NOW, NOW.plusHours(1)));
        MockHttpServletResponse response = new MockHttpServletResponse();

        SessionTokens tokens = authenticationService.signIn("alice@example.com", "secret", response);

        assertThat(tokens.accessToken()).isEqualTo("jwt");
        assertThat(tokens.expiresIn()).isEqualTo(3600);
        verify(userSessionService).create("jwt", alice, NOW.plusHours(1));
        assertThat(response.getHeader(HttpHeaders.SET_COOKIE))
                .startsWith("access_token=jwt")
                .contains("HttpOnly")
                .contains("SameSite=Strict")
                .contains("Max-Age=3600");
        assertThat(SecurityUtils.getCurrentUserId()).isEqualTo(USER_ID);
        assertThat(authenticationService.isAuthenticated()).isTrue();
    }

    @Test
    @DisplayName("unknown email and wrong password fail the same way")
    void badCredentialsAreIndistinguishable() {
        when(userService.findByEmail("nobody@example.com")).thenReturn(Optional.empty());
        when(userService.findByEmail("alice@example.com")).thenReturn(Optional.of(alice));
        when(passwordEncoder.matches("wrong", "$2a$hash")).thenReturn(false);

        ProblemException unknown = catchProblem(() -> authenticationService.signIn("nobody@example.com", "wrong", null));
        ProblemException wrong = catchProblem(() -> authenticationService.signIn("alice@example.com", "wrong", null));

        assertThat(unknown.getKind()).isEqualTo(ProblemKind.UNAUTHORIZED);
        assertThat(unknown.getCode()).isEqualTo(AuthenticationService.INVALID_CREDENTIALS);
        assertThat(wrong.getCode()).isEqualTo(unknown.getCode());
        assertThat(wrong.getDetailMessage()).isEqualTo(unknown.getDetailMessage());
        verify(userSessionService, never()).create(anyString(), any(), any());
    }

    @Test
    void userWithoutPasswordCannotSignIn() {
        alice.setPasswordHash(null);

        assertThatThrownBy(() -> authenticationService.authenticate(alice, "secret", null))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo(AuthenticationService.INVALID_CREDENTIALS));
    }

    @Test
    @DisplayName("a disabled user is rejected even with the right password and gets no session")
    void disabledUserIsRejected() {
        alice.setEnabled(false);
        lenient().when(passwordEncoder.matches("secret", "$2a$hash")).thenReturn(true);

        assertThatThrownBy(() -> authenticationService.authenticate(alice, "secret", new MockHttpServletResponse()))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getKind()).isEqualTo(ProblemKind.INVALID_STATE))
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("USER_DISABLED"));
        verify(userSessionService, never()).create(anyString(), any(), any());
        verifyNoInteractions(jwtTokenService);
        assertThat(authenticationService.isAuthenticated()).isFalse();
    }

    @Test
    void logoutWithoutTokenStillClearsCookie() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        authenticationService.logout(new MockHttpServletRequest(), response);

        assertThat(response.getHeader(HttpHeaders.SET_COOKIE)).startsWith("access_token=;").contains("Max-Age=0");
        verify(userSessionService, never()).deleteByToken(anyString());
    }

    @Test
    void logoutWithUnknownSessionSucceeds() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer stale");
        doThrow(ProblemException.notFound("SESSION_NOT_FOUND", "Session not found"))
                .when(userSessionService).deleteByToken("stale");

        assertThatCode(() -> authenticationService.logout(request, new MockHttpServletResponse()))
                .doesNotThrowAnyException();
        assertThat(authenticationService.isAuthenticated()).isFalse();
    }

    @Test
    void loadPrincipalAttachesUser() {
        stubClaims();
        when(userSessionService.findByToken("jwt")).thenReturn(Optional.of(session()));
        when(userSessionService.isActive(any())).thenReturn(true);
        when(userService.findById(USER_ID)).thenReturn(Optional.of(alice));

        AuthenticatedUser principal = authenticationService.loadPrincipalFromToken("jwt");

        assertThat(principal.userId()).isEqualTo(USER_ID);
        assertThat(authenticationService.getAuthenticatedUser()).isEqualTo(principal);
        assertThat(authenticationService.hasAnyRole(List.of("admin", "member"))).isTrue();
        assertThat(authenticationService.hasAllRoles(List.of("admin", "member"))).isFalse();
    }

    @Test
    void loadPrincipalRequiresSessionRecord() {
        stubClaims();
        when(userSessionService.findByToken("jwt")).thenReturn(Optional.empty());

        assertUnauthorized("SESSION_NOT_FOUND");
    }

    @Test
    void loadPrincipalRejectsExpiredSession() {
        stubClaims();
        when(userSessionService.findByToken("jwt")).thenReturn(Optional.of(session()));
        when(userSessionService.isActive(any())).thenReturn(false);

        assertUnauthorized("SESSION_EXPIRED");
    }

    @Test
    void loadPrincipalRejectsDeletedOrDisabledUser() {
        stubClaims();
        when(userSessionService.findByToken("jwt")).thenReturn(Optional.of(session()));
        when(userSessionService.isActive(any())).thenReturn(true);
        when(userService.findById(USER_ID)).thenReturn(Optional.empty(), Optional.of(alice));

        assertUnauthorized("USER_NOT_FOUND");

        alice.setEnabled(false);
        assertUnauthorized("USER_DISABLED");
    }

    @Test
    void roleChecksRequireAPrincipal() {
        assertThat(authenticationService.isAuthenticated()).isFalse();
        assertThatThrownBy(() -> authenticationService.hasAnyRole(List.of("member")))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getKind()).isEqualTo(ProblemKind.UNAUTHORIZED));
    }

    private void stubClaims() {
        when(jwtTokenService.verify("jwt")).thenReturn(new SessionClaims(
                "jti", USER_ID, "alice@example.com", "alice@example.com", List.of("member"),
                null, null, NOW, NOW.plusHours(1)));
    }

    private UserSession session() {
        return new UserSession("jwt", alice, NOW, NOW.plusHours(1));
    }

    private void assertUnauthorized(String code) {
        ProblemException problem = catchProblem(() -> authenticationService.loadPrincipalFromToken("jwt"));
        assertThat(problem.getKind()).isEqualTo(ProblemKind.UNAUTHORIZED);
        assertThat(problem.getCode()).isEqualTo(code);
    }

    private static ProblemException catchProblem(Runnable call) {
        try {
            call.run();
        } catch (ProblemException ex) {
            return ex;
        }
        throw new AssertionError("expected a ProblemException");
    }
}
