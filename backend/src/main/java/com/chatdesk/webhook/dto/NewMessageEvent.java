package com.chatdesk.webhook.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Background notice that a customer message was stored, for consumers outside the realtime
 * fabric. Carries ids only.
 */
public record NewMessageEvent(UUID chatId,
                              UUID messageId,
                              UUID tenantId,
                              String platform,
                              @JsonProperty("isFromCustomer") boolean fromCustomer) {
}
