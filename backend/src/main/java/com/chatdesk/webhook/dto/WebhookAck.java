package com.chatdesk.webhook.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAck(String status, String error, String message) {

    public static WebhookAck received() {
        return new WebhookAck("received", null, null);
    }

    public static WebhookAck rejected(String error, String message) {
        return new WebhookAck(null, error, message);
    }
}
