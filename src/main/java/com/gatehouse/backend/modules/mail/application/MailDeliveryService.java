package com.gatehouse.backend.modules.mail.application;

/**
 * Outbound mail transport used to deliver action tokens.
 */
public interface MailDeliveryService {

    void send(String toEmail, String subject, String body);
}
