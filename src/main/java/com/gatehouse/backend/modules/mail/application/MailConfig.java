package com.gatehouse.backend.modules.mail.application;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MailConfig {

    @Bean
    @ConditionalOnMissingBean(MailDeliveryService.class)
    public MailDeliveryService loggingMailDeliveryService() {
        return new LoggingMailDeliveryService();
    }
}
