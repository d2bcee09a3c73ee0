package com.gatehouse.backend.modules.action.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import com.gatehouse.backend.global.error.ProblemException;
import com.gatehouse.backend.global.security.SecureTokenGenerator;
import com.gatehouse.backend.modules.action.domain.ActionToken;
import com.gatehouse.backend.modules.action.domain.ActionTokenType;
import com.gatehouse.backend.modules.action.domain.ActionTypeSet;
import com.gatehouse.backend.modules.action.infrastructure.persistence.ActionTokenRepository;
import com.gatehouse.backend.modules.action.infrastructure.persistence.ActionTokenSearchCondition;
import com.gatehouse.backend.modules.user.application.RoleService;
import com.gatehouse.backend.modules.user.application.UserService;
import com.gatehouse.backend.modules.user.domain.AppUser;
import com.gatehouse.backend.modules.user.domain.Role;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Issues, validates and revokes single-use action tokens.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class ActionTokenService {

    private static final Logger log = LoggerFactory.getLogger(ActionTokenService.class);

    static final int MAX_ALLOCATION_ATTEMPTS = 100;
    static final String INVALID_ACTION_TOKEN = "INVALID_ACTION_TOKEN";

    private final ActionTokenRepository actionTokenRepository;
    private final UserService userService;
    private final RoleService roleService;
    private final SecureTokenGenerator tokenGenerator;
    private final TransactionTemplate insertTransaction;
    private final Clock clock;

    public ActionTokenService(
            ActionTokenRepository actionTokenRepository,
            UserService userService,
            RoleService roleService,
            SecureTokenGenerator tokenGenerator,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.actionTokenRepository = actionTokenRepository;
        this.userService = userService;
        this.roleService = roleService;
        this.tokenGenerator = tokenGenerator;
        this.insertTransaction = new TransactionTemplate(transactionManager);
        this.insertTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public ActionToken create(CreateActionTokenRequest request) {
        int type = request.type();
        if (!ActionTypeSet.isValid(type)) {
            throw ProblemException.invalidRequest("INVALID_ACTION_TYPE", "At least one known action is required");
        }
        boolean invite = ActionTypeSet.contains(type, ActionTokenType.INVITE);
        boolean needsUser = ActionTypeSet.requiresExistingPrincipal(type);
        if (invite && needsUser) {
            throw ProblemException.invalidRequest("INVALID_ACTION_TYPE",
                    "An invitation cannot be combined with actions on an existing user");
        }
        if (invite && request.userId() != null) {
            throw ProblemException.invalidRequest("USER_NOT_ALLOWED", "An invitation cannot target an existing user");
        }
        if (needsUser && request.userId() == null) {
            throw ProblemException.invalidRequest("USER_REQUIRED",
                    "A user is required for " + ActionTypeSet.describe(type) + " token");
        }

        AppUser user = null;
        if (request.userId() != null) {
            user = userService.findById(request.userId())
                    .orElseThrow(() -> ProblemException.invalidRequest("USER_NOT_FOUND",
                            "User with id " + request.userId() + " not found"));
        }
        String email = user != null ? user.getEmail() : UserService.normalizeEmail(request.email());
        if (email == null) {
            throw ProblemException.invalidRequest("EMAIL_REQUIRED",
                    "An email is required for " + ActionTypeSet.describe(type) + " token");
        }

        List<Role> roles = resolveRoles(request.roles());

        Integer expiresIn = request.expiresIn();
        if (expiresIn != null && expiresIn <= 0) {
            throw ProblemException.invalidRequest("INVALID_EXPIRATION", "expiresIn must be a positive number of hours");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = expiresIn != null ? now.plusHours(expiresIn) : null;

        for (int attempt = 1; attempt <= MAX_ALLOCATION_ATTEMPTS; attempt++) {
            String token = tokenGenerator.generate();
            if (actionTokenRepository.existsById(token)) {
                log.debug("Action token collision on attempt {}", attempt);
                continue;
            }
            ActionToken candidate = ActionToken.issue(token, type, email, user, roles, now, expiresAt);
            try {
                ActionToken saved = insertTransaction.execute(status -> actionTokenRepository.saveAndFlush(candidate));
                log.info("Issued action token {} for {} (expires {})", ActionTypeSet.describe(type), email,
                        expiresAt != null ? expiresAt : "never");
                return saved;
            } catch (DataIntegrityViolationException ex) {
                log.debug("Action token insert collided on attempt {}", attempt, ex);
            }
        }
        log.error("Unable to allocate a unique action token after {} attempts", MAX_ALLOCATION_ATTEMPTS);
        throw ProblemException.internal("TOKEN_ALLOCATION_FAILED", "unable to allocate a unique token");
    }

    /**
     * Returns the stored token when it belongs to {@code email}, grants every required action and
     * has not expired. An expired token is deleted before the failure is raised.
     */
    public ActionToken validate(ValidateActionTokenRequest request) {
        return validate(request, actionTokenRepository::findByToken);
    }

    /**
     * Same checks as {@link #validate(ValidateActionTokenRequest)}, but the token row stays locked
     * until the surrounding transaction ends. Concurrent consumers of the same token are
     * serialized, and the later one finds the token gone.
     */
    public ActionToken validateForUpdate(ValidateActionTokenRequest request) {
        return validate(request, actionTokenRepository::findByTokenForUpdate);
    }

    private ActionToken validate(ValidateActionTokenRequest request, Function<String, Optional<ActionToken>> lookup) {
        if (request.requiredActions() == 0) {
            throw ProblemException.invalidRequest("INVALID_ACTION_TYPE", "At least one required action is expected");
        }
        if (request.token() == null || request.token().isBlank()) {
            throw invalidActionToken();
        }
        ActionToken actionToken = lookup.apply(request.token())
                .orElseThrow(ActionTokenService::invalidActionToken);

        if (request.email() == null || !actionToken.getEmail().equalsIgnoreCase(request.email().trim())) {
            log.warn("Action token presented with a mismatching email");
            throw invalidActionToken();
        }
        if (!ActionTypeSet.containsAll(actionToken.getType(), request.requiredActions())) {
            log.warn("Action token for {} does not grant {}", actionToken.getEmail(),
                    ActionTypeSet.describe(request.requiredActions()));
            throw invalidActionToken();
        }
        if (actionToken.isExpired(OffsetDateTime.now(clock))) {
            actionTokenRepository.deleteByToken(actionToken.getToken());
            log.info("Deleted expired action token for {}", actionToken.getEmail());
            throw invalidActionToken();
        }
        return actionToken;
    }

    public void revoke(String token) {
        int deleted = token == null ? 0 : actionTokenRepository.deleteByToken(token);
        if (deleted == 0) {
            throw ProblemException.notFound("ACTION_TOKEN_NOT_FOUND", "Action token not found");
        }
    }

    public int purge() {
        int deleted = actionTokenRepository.deleteExpired(OffsetDateTime.now(clock));
        if (deleted > 0) {
            log.info("Purged {} expired action tokens", deleted);
        } else {
            log.debug("No expired action tokens to purge");
        }
        return deleted;
    }

    @Transactional(readOnly = true)
    public Optional<ActionToken> findByToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return actionTokenRepository.findByToken(token);
    }

    @Transactional(readOnly = true)
    public Page<ActionToken> search(ActionTokenSearchCondition condition, Pageable pageable) {
        return actionTokenRepository.search(condition == null ? ActionTokenSearchCondition.any() : condition, pageable);
    }

    private List<Role> resolveRoles(List<String> names) {
        if (names.isEmpty()) {
            return List.of();
        }
        List<Role> roles = roleService.findByNames(names);
        Set<String> found = new HashSet<>(roles.stream().map(Role::getName).toList());
        List<String> missing = names.stream().filter(name -> !found.contains(name)).distinct().toList();
        if (!missing.isEmpty()) {
            throw ProblemException.invalidRequest("ROLE_NOT_FOUND", "Unknown roles: " + String.join(", ", missing));
        }
        return roles;
    }

    private static ProblemException invalidActionToken() {
        return ProblemException.forbidden(INVALID_ACTION_TOKEN, "invalid action token");
    }
}
