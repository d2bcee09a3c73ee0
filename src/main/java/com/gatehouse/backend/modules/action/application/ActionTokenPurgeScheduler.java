package com.gatehouse.backend.modules.action.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class ActionTokenPurgeScheduler {

    private static final Logger log = LoggerFactory.getLogger(ActionTokenPurgeScheduler.class);

    private final ActionTokenService actionTokenService;

    public ActionTokenPurgeScheduler(ActionTokenService actionTokenService) {
        this.actionTokenService = actionTokenService;
    }

    @Scheduled(cron = "${gatehouse.actions.purge-cron:0 0 * * * *}")
    public void purgeExpiredTokens() {
        try {
            int purged = actionTokenService.purge();
            log.debug("Scheduled action token purge removed {} tokens", purged);
        } catch (RuntimeException ex) {
            log.error("Scheduled action token purge failed", ex);
        }
    }
}
