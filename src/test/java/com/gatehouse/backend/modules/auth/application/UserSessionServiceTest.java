package com.gatehouse.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import com.gatehouse.backend.global.error.ProblemException;
import com.gatehouse.backend.global.error.ProblemKind;
import com.gatehouse.backend.modules.auth.domain.UserSession;
import com.gatehouse.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.gatehouse.backend.modules.user.domain.AppUser;
import com.gatehouse.backend.support.TestFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UserSessionServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");
    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000401");

    @Mock
    private UserSessionRepository userSessionRepository;

    private Clock clock;
    private AppUser alice;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        alice = TestFixtures.user(USER_ID, "alice@example.com");
    }

    @Test
    void createReplacesPreviousSessionsWhenSinglePerUser() {
        UserSessionService service = service(true);
        when(userSessionRepository.save(any(UserSession.class))).thenAnswer(invocation -> invocation.getArgument(0));

        UserSession session = service.create("jwt", alice, NOW.plusHours(1));

        InOrder order = inOrder(userSessionRepository);
        order.verify(userSessionRepository).deleteByUserId(USER_ID);
        order.verify(userSessionRepository).save(session);
        assertThat(session.getLoginDate()).isEqualTo(NOW);
        assertThat(session.getExpirationDate()).isEqualTo(NOW.plusHours(1));
    }

    @Test
    void createKeepsOtherSessionsWhenMultipleAllowed() {
        UserSessionService service = service(false);
        when(userSessionRepository.save(any(UserSession.class))).thenAnswer(invocation -> invocation.getArgument(0));

        service.create("jwt", alice, NOW.plusHours(1));

        verify(userSessionRepository, never()).deleteByUserId(any());
    }

    @Test
    void deleteByTokenFailsWhenNothingMatches() {
        UserSessionService service = service(true);
        when(userSessionRepository.deleteByToken("gone")).thenReturn(0);

        assertThatThrownBy(() -> service.deleteByToken("gone"))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getKind()).isEqualTo(ProblemKind.NOT_FOUND));
    }

    @Test
    void sessionIsActiveUntilItsExpirationDate() {
        UserSessionService service = service(true);

        assertThat(service.isActive(new UserSession("a", alice, NOW.minusHours(1), NOW.plusSeconds(1)))).isTrue();
        assertThat(service.isActive(new UserSession("b", alice, NOW.minusHours(1), NOW))).isFalse();
    }

    @Test
    void blankTokenIsNeverLookedUp() {
        assertThat(service(true).findByToken(" ")).isEmpty();
        verify(userSessionRepository, never()).findByToken(any());
    }

    @Test
    void deleteExpiredUsesCurrentTime() {
        when(userSessionRepository.deleteExpired(NOW)).thenReturn(3);

        assertThat(service(true).deleteExpired()).isEqualTo(3);
    }

    private UserSessionService service(boolean singlePerUser) {
        return new UserSessionService(
                userSessionRepository,
                new SessionProperties(null, null, null, singlePerUser),
                clock
        );
    }
}
