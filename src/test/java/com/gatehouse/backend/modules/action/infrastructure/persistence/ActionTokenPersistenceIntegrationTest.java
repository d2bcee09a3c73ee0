package com.gatehouse.backend.modules.action.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.UUID;

import com.gatehouse.backend.global.error.ProblemException;
import com.gatehouse.backend.modules.action.application.ActionTokenService;
import com.gatehouse.backend.modules.action.application.CreateActionTokenRequest;
import com.gatehouse.backend.modules.action.application.ValidateActionTokenRequest;
import com.gatehouse.backend.modules.action.domain.ActionToken;
import com.gatehouse.backend.modules.action.domain.ActionTokenType;
import com.gatehouse.backend.modules.action.domain.ActionTypeSet;
import com.gatehouse.backend.modules.user.application.NewUser;
import com.gatehouse.backend.modules.user.application.UserService;
import com.gatehouse.backend.modules.user.domain.AppUser;
import com.gatehouse.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

@SpringBootTest
class ActionTokenPersistenceIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private ActionTokenService actionTokenService;

    @Autowired
    private UserService userService;

    private AppUser user;

    @BeforeEach
    void setUp() {
        String email = "tokens-" + UUID.randomUUID() + "@example.com";
        user = userService.create(new NewUser(email, null, null, List.of("member"), false, false, false));
    }

    @Test
    void searchMatchesTokensContainingEveryRequiredAction() {
        int emailAndTerms = ActionTypeSet.of(ActionTokenType.VALIDATE_EMAIL, ActionTokenType.ACCEPT_TERMS);
        ActionToken both = create(emailAndTerms);
        ActionToken emailOnly = create(ActionTokenType.VALIDATE_EMAIL.bit());
        create(ActionTokenType.ACCEPT_TERMS.bit());

        Page<ActionToken> validating = actionTokenService.search(
                new ActionTokenSearchCondition(ActionTokenType.VALIDATE_EMAIL.bit(), null, user.getId(), null),
                PageRequest.of(0, 10));
        Page<ActionToken> combined = actionTokenService.search(
                new ActionTokenSearchCondition(emailAndTerms, user.getEmail().toUpperCase(), null, null),
                PageRequest.of(0, 10));

        assertThat(validating.getContent()).extracting(ActionToken::getToken)
                .containsExactlyInAnyOrder(both.getToken(), emailOnly.getToken());
        assertThat(combined.getContent()).extracting(ActionToken::getToken).containsExactly(both.getToken());
    }

    @Test
    void invitationKeepsItsRoles() {
        String email = "invitee-" + UUID.randomUUID() + "@example.com";
        ActionToken invitation = actionTokenService.create(new CreateActionTokenRequest(
                ActionTokenType.INVITE.bit(), email, null, List.of("admin", "member"), 72));

        ActionToken loaded = actionTokenService.findByToken(invitation.getToken()).orElseThrow();

        assertThat(loaded.getRoleNames()).containsExactlyInAnyOrder("admin", "member");
        assertThat(actionTokenService.search(
                new ActionTokenSearchCondition(null, null, null, "admin"), PageRequest.of(0, 50)).getContent())
                .extracting(ActionToken::getToken)
                .contains(invitation.getToken());
    }

    @Test
    void revokedTokenNoLongerValidates() {
        ActionToken token = create(ActionTokenType.RESET_PASSWORD.bit());
        ValidateActionTokenRequest request = new ValidateActionTokenRequest(
                token.getToken(), user.getEmail(), ActionTokenType.RESET_PASSWORD.bit());

        assertThat(actionTokenService.validate(request).getUser().getId()).isEqualTo(user.getId());
        actionTokenService.revoke(token.getToken());

        assertThatThrownBy(() -> actionTokenService.validate(request)).isInstanceOf(ProblemException.class);
        assertThatThrownBy(() -> actionTokenService.revoke(token.getToken())).isInstanceOf(ProblemException.class);
    }

    private ActionToken create(int type) {
        return actionTokenService.create(new CreateActionTokenRequest(type, null, user.getId(), null, 24));
    }
}
