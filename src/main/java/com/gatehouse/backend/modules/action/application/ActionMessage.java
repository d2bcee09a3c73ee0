package com.gatehouse.backend.modules.action.application;

public record ActionMessage(String subject, String body) {
}
