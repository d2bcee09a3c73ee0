package com.gatehouse.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.gatehouse.backend.global.error.ProblemException;
import com.gatehouse.backend.modules.auth.domain.UserSession;
import com.gatehouse.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.gatehouse.backend.modules.user.domain.AppUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(noRollbackFor = ProblemException.class)
public class UserSessionService {

    private static final Logger log = LoggerFactory.getLogger(UserSessionService.class);

    private final UserSessionRepository userSessionRepository;
    private final SessionProperties sessionProperties;
    private final Clock clock;

    public UserSessionService(
            UserSessionRepository userSessionRepository,
            SessionProperties sessionProperties,
            Clock clock
    ) {
        this.userSessionRepository = userSessionRepository;
        this.sessionProperties = sessionProperties;
        this.clock = clock;
    }

    public UserSession create(String token, AppUser user, OffsetDateTime expirationDate) {
        if (sessionProperties.singlePerUser()) {
            int dropped = userSessionRepository.deleteByUserId(user.getId());
            if (dropped > 0) {
                log.debug("Dropped {} previous sessions of user {}", dropped, user.getId());
            }
        }
        UserSession session = new UserSession(token, user, OffsetDateTime.now(clock), expirationDate);
        return userSessionRepository.save(session);
    }

    @Transactional(readOnly = true)
    public Optional<UserSession> findByToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return userSessionRepository.findByToken(token);
    }

    public void deleteByToken(String token) {
        int deleted = token == null ? 0 : userSessionRepository.deleteByToken(token);
        if (deleted == 0) {
            throw ProblemException.notFound("SESSION_NOT_FOUND", "Session not found");
        }
    }

    public boolean isActive(UserSession session) {
        return session.isActive(OffsetDateTime.now(clock));
    }

    public int deleteExpired() {
        int deleted = userSessionRepository.deleteExpired(OffsetDateTime.now(clock));
        log.info("Removed {} expired sessions", deleted);
        return deleted;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void purgeExpiredOnStartup() {
        deleteExpired();
    }
}
