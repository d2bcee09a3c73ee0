package com.gatehouse.backend.modules.mail.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback transport that only logs outgoing messages. Deployments register their own
 * {@link MailDeliveryService} bean to actually deliver mail.
 */
public class LoggingMailDeliveryService implements MailDeliveryService {

    private static final Logger log = LoggerFactory.getLogger(LoggingMailDeliveryService.class);

    @Override
    public void send(String toEmail, String subject, String body) {
        log.info("Mail to {} with subject '{}' ({} chars) not delivered: no transport configured",
                toEmail, subject, body == null ? 0 : body.length());
        log.debug("Mail body for {}:\n{}", toEmail, body);
    }
}
