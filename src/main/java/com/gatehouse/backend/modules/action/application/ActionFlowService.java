package com.gatehouse.backend.modules.action.application;

import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Function;

import com.gatehouse.backend.global.error.ProblemException;
import com.gatehouse.backend.global.error.ProblemKind;
import com.gatehouse.backend.modules.action.domain.ActionToken;
import com.gatehouse.backend.modules.action.domain.ActionTokenType;
import com.gatehouse.backend.modules.action.domain.ActionTypeSet;
import com.gatehouse.backend.modules.auth.application.AuthenticationService;
import com.gatehouse.backend.modules.auth.application.SessionTokens;
import com.gatehouse.backend.modules.mail.application.MailDeliveryService;
import com.gatehouse.backend.modules.user.application.NewUser;
import com.gatehouse.backend.modules.user.application.UserService;
import com.gatehouse.backend.modules.user.application.UserUpdate;
import com.gatehouse.backend.modules.user.domain.AppUser;

import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Account workflows built on action tokens: sending a token by mail, then applying what the
 * token authorizes once the user presents it back.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class ActionFlowService {

    private static final Logger log = LoggerFactory.getLogger(ActionFlowService.class);

    private static final int PASSWORD_ACTIONS = ActionTypeSet.of(ActionTokenType.CREATE_PASSWORD, ActionTokenType.RESET_PASSWORD);

    private final ActionTokenService actionTokenService;
    private final UserService userService;
    private final AuthenticationService authenticationService;
    private final MailDeliveryService mailDeliveryService;
    private final ActionMessageComposer messageComposer;
    private final ActionProperties actionProperties;

    public ActionFlowService(
            ActionTokenService actionTokenService,
            UserService userService,
            AuthenticationService authenticationService,
            MailDeliveryService mailDeliveryService,
            ActionMessageComposer messageComposer,
            ActionProperties actionProperties
    ) {
        this.actionTokenService = actionTokenService;
        this.userService = userService;
        this.authenticationService = authenticationService;
        this.mailDeliveryService = mailDeliveryService;
        this.messageComposer = messageComposer;
        this.actionProperties = actionProperties;
    }

    public ActionToken sendActionToken(CreateActionTokenRequest request, String frontendUrl) {
        return sendActionToken(request, frontendUrl, null);
    }

    /**
     * Issues a token for {@code request} and mails it. When the request targets a user,
     * {@code preAction} may patch that user before the token is created.
     */
    public ActionToken sendActionToken(
            CreateActionTokenRequest request,
            String frontendUrl,
            Function<AppUser, UserUpdate> preAction
    ) {
        if (frontendUrl == null || frontendUrl.isBlank()) {
            throw ProblemException.invalidRequest("FRONTEND_URL_REQUIRED", "A frontend URL is required");
        }

        AppUser user = null;
        String email;
        if (request.userId() != null) {
            user = userService.getById(request.userId());
            email = user.getEmail();
            if (preAction != null) {
                user = userService.update(user.getId(), preAction.apply(user));
            }
        } else {
            email = UserService.normalizeEmail(request.email());
            if (email == null) {
                throw ProblemException.invalidRequest("EMAIL_REQUIRED", "Either an email or a user is required");
            }
        }

        int expiresIn = request.expiresIn() != null
                ? request.expiresIn()
                : actionProperties.maxValidityHours(request.type());

        ActionToken token = actionTokenService.create(new CreateActionTokenRequest(
                request.type(),
                email,
                user != null ? user.getId() : null,
                request.roles(),
                expiresIn
        ));

        String link = actionProperties.routeFor(request.type())
                .map(route -> buildActionLink(frontendUrl, route, token.getToken(), token.getEmail()))
                .orElse(null);
        ActionMessage message = messageComposer.compose(request.type(), token.getToken(), expiresIn, link);
        mailDeliveryService.send(email, message.subject(), message.body());

        log.debug("Action token {} sent to {}", ActionTypeSet.describe(request.type()), email);
        return token;
    }

    /**
     * Validates the submitted token for {@code requiredActions}, applies the corresponding
     * changes to its user, then revokes the token. The token row is locked while this runs and any
     * failure, including a failed revoke, rolls the user update back.
     */
    @Transactional
    public AppUser processActionToken(ActionTokenSubmission submission, int requiredActions) {
        ActionToken token = actionTokenService.validateForUpdate(
                new ValidateActionTokenRequest(submission.token(), submission.email(), requiredActions));
        if (token.getUser() == null) {
            throw ProblemException.invalidRequest("USER_REQUIRED", "This action token is not bound to a user");
        }

        UserUpdate update = UserUpdate.empty();
        if (ActionTypeSet.containsAny(requiredActions, PASSWORD_ACTIONS)) {
            if (submission.password() == null || submission.password().isBlank()) {
                throw ProblemException.invalidRequest("PASSWORD_REQUIRED", "A password is required for this action");
            }
            update = update.withPassword(submission.password());
        }
        if (ActionTypeSet.contains(requiredActions, ActionTokenType.VALIDATE_EMAIL)) {
            update = update.withEmailValidated(true);
        }
        if (ActionTypeSet.contains(requiredActions, ActionTokenType.ACCEPT_TERMS)) {
            if (!Boolean.TRUE.equals(submission.acceptedTerms())) {
                log.warn("User {} did not accept the terms of service", token.getEmail());
                throw ProblemException.invalidRequest("TERMS_NOT_ACCEPTED", "The terms of service must be accepted");
            }
            update = update.withAcceptedTerms(true);
        }
        if (ActionTypeSet.contains(requiredActions, ActionTokenType.ACCEPT_PRIVACY_POLICY)) {
            if (!Boolean.TRUE.equals(submission.acceptedPrivacyPolicy())) {
                log.warn("User {} did not accept the privacy policy", token.getEmail());
                throw ProblemException.invalidRequest("PRIVACY_POLICY_NOT_ACCEPTED", "The privacy policy must be accepted");
            }
            update = update.withAcceptedPrivacyPolicy(true);
        }

        AppUser updated = userService.update(token.getUser().getId(), update);
        actionTokenService.revoke(token.getToken());

        log.debug("User {} processed actions {}", updated.getEmail(), ActionTypeSet.describe(requiredActions));
        return updated;
    }

    public ActionToken sendInvitation(InvitationRequest invitation, String frontendUrl) {
        if (userService.exists(invitation.email())) {
            log.warn("Invitation refused: a user with the same email already exists");
            throw ProblemException.invalidRequest("USER_ALREADY_EXISTS", "A user with the same email already exists");
        }
        List<String> roles = invitation.roles() != null ? invitation.roles() : actionProperties.defaultRoles();
        return sendActionToken(
                new CreateActionTokenRequest(ActionTokenType.INVITE.bit(), invitation.email(), null, roles, invitation.expiresIn()),
                frontendUrl
        );
    }

    /**
     * Creates the invited user with the roles carried by the invitation and signs them in.
     */
    @Transactional
    public SessionTokens acceptInvitation(AcceptInvitationRequest request, HttpServletResponse response) {
        ActionToken token = actionTokenService.validateForUpdate(
                new ValidateActionTokenRequest(request.token(), request.email(), ActionTokenType.INVITE.bit()));
        if (request.password() == null || request.password().isBlank()) {
            throw ProblemException.invalidRequest("PASSWORD_REQUIRED", "A password is required to accept an invitation");
        }

        AppUser user = userService.create(new NewUser(
                token.getEmail(),
                request.username(),
                request.password(),
                token.getRoleNames(),
                true,
                request.acceptedTerms(),
                request.acceptedPrivacyPolicy()
        ));
        actionTokenService.revoke(token.getToken());

        SessionTokens tokens = authenticationService.authenticate(user, request.password(), response);
        log.debug("User {} accepted an invitation", user.getEmail());
        return tokens;
    }

    /**
     * Registers a user with the default roles. The email stays unvalidated until the user goes
     * through {@link #sendEmailValidation(UUID, String)}.
     */
    public AppUser signUp(Registration registration) {
        if (!registration.acceptedTerms() || !registration.acceptedPrivacyPolicy()) {
            log.warn("Sign-up refused for {}: terms or privacy policy not accepted", registration.email());
            throw ProblemException.invalidRequest("TERMS_NOT_ACCEPTED",
                    "The terms of service and the privacy policy must be accepted");
        }
        if (registration.password() == null || registration.password().isBlank()) {
            throw ProblemException.invalidRequest("PASSWORD_REQUIRED", "A password is required to sign up");
        }

        AppUser user = userService.create(new NewUser(
                registration.email(),
                registration.username(),
                registration.password(),
                actionProperties.defaultRoles(),
                false,
                true,
                true
        ));
        log.debug("User {} signed up", user.getEmail());
        return user;
    }

    public ActionToken sendEmailValidation(UUID userId, String frontendUrl) {
        return sendActionToken(
                userRequest(ActionTokenType.VALIDATE_EMAIL, userId),
                frontendUrl,
                user -> UserUpdate.empty().withEmailValidated(false)
        );
    }

    public ActionToken sendCreatePassword(UUID userId, String frontendUrl) {
        return sendActionToken(userRequest(ActionTokenType.CREATE_PASSWORD, userId), frontendUrl);
    }

    /**
     * Sends a reset link when {@code email} belongs to a user. Unknown emails are ignored so the
     * caller cannot tell them apart.
     */
    public void requestPasswordReset(String email, String frontendUrl) {
        userService.findByEmail(email).ifPresentOrElse(
                user -> sendActionToken(userRequest(ActionTokenType.RESET_PASSWORD, user.getId()), frontendUrl),
                () -> log.warn("Password reset requested for unknown email {}", email)
        );
    }

    public ActionToken addAcceptTerms(UUID userId) {
        return actionTokenService.create(userRequest(ActionTokenType.ACCEPT_TERMS, userId));
    }

    public ActionToken addAcceptPrivacyPolicy(UUID userId) {
        return actionTokenService.create(userRequest(ActionTokenType.ACCEPT_PRIVACY_POLICY, userId));
    }

    public AppUser validateEmail(ActionTokenSubmission submission) {
        return processActionToken(submission, ActionTokenType.VALIDATE_EMAIL.bit());
    }

    public AppUser createPassword(ActionTokenSubmission submission) {
        return processActionToken(submission, ActionTokenType.CREATE_PASSWORD.bit());
    }

    public AppUser resetPassword(ActionTokenSubmission submission) {
        return processActionToken(submission, ActionTokenType.RESET_PASSWORD.bit());
    }

    public AppUser acceptTerms(ActionTokenSubmission submission) {
        return processActionToken(submission, ActionTokenType.ACCEPT_TERMS.bit());
    }

    public AppUser acceptPrivacyPolicy(ActionTokenSubmission submission) {
        return processActionToken(submission, ActionTokenType.ACCEPT_PRIVACY_POLICY.bit());
    }

    static String buildActionLink(String frontendUrl, String route, String token, String email) {
        String base = frontendUrl.endsWith("/") ? frontendUrl.substring(0, frontendUrl.length() - 1) : frontendUrl;
        String path = route.startsWith("/") ? route : "/" + route;
        try {
            return UriComponentsBuilder.fromHttpUrl(base + path)
                    .queryParam("token", "{token}")
                    .queryParam("email", "{email}")
                    .encode()
                    .buildAndExpand(token, email.toLowerCase(Locale.ROOT))
                    .toUriString();
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(ProblemKind.INVALID_REQUEST,
                    "INVALID_FRONTEND_URL", "The frontend URL is not a valid http(s) URL", ex);
        }
    }

    private static CreateActionTokenRequest userRequest(ActionTokenType type, UUID userId) {
        return new CreateActionTokenRequest(type.bit(), null, userId, List.of(), null);
    }
}
