package com.chatdesk.webhook.service;

import com.chatdesk.socialconnection.domain.Platform;
import com.chatdesk.webhook.dto.MessageCandidate;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts message candidates from a Meta webhook envelope.
 *
 * <ul>
 *   <li>{@code entry[].messaging[]}: Messenger ({@code object=page}) and Instagram
 *       ({@code object=instagram}) message and postback events. The account is the entry id.</li>
 *   <li>{@code entry[].changes[]} with {@code field=messages}: WhatsApp Cloud API messages.
 *       The account is {@code value.metadata.phone_number_id}.</li>
 * </ul>
 *
 * Events without a sender are skipped. Events without a timestamp are stamped with the
 * receive time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookPayloadParser {

    private static final String OBJECT_INSTAGRAM = "instagram";
    private static final String FIELD_MESSAGES = "messages";

    private final Clock clock;

    public List<MessageCandidate> parse(JsonNode envelope) {
        List<MessageCandidate> candidates = new ArrayList<>();
        if (envelope == null || !envelope.path("entry").isArray()) {
            return candidates;
        }

        Platform messagingPlatform = OBJECT_INSTAGRAM.equals(envelope.path("object").asText())
                ? Platform.INSTAGRAM
                : Platform.FACEBOOK;

        for (JsonNode entry : envelope.path("entry")) {
            for (JsonNode event : entry.path("messaging")) {
                parseMessagingEvent(messagingPlatform, entry.path("id").asText(null), event, candidates);
            }
            for (JsonNode change : entry.path("changes")) {
                if (FIELD_MESSAGES.equals(change.path("field").asText())) {
                    parseWhatsAppChange(change.path("value"), candidates);
                }
            }
        }
        return candidates;
    }

    private void parseMessagingEvent(Platform platform, String pageId, JsonNode event, List<MessageCandidate> out) {
        String senderId = event.path("sender").path("id").asText(null);
        if (senderId == null || pageId == null) {
            log.warn("Skipping messaging event without sender or page id: platform={}", platform);
            return;
        }
        Instant timestamp = event.has("timestamp")
                ? Instant.ofEpochMilli(event.path("timestamp").asLong())
                : Instant.now(clock);

        JsonNode message = event.path("message");
        if (message.isObject()) {
            out.add(MessageCandidate.builder()
                    .platform(platform)
                    .accountId(pageId)
                    .senderId(senderId)
                    .platformMessageId(message.path("mid").asText(null))
                    .text(message.path("text").asText(null))
                    .attachments(message.path("attachments").isArray() ? message.get("attachments") : null)
                    .platformType(MessageCandidate.TYPE_MESSAGE)
                    .timestamp(timestamp)
                    .build());
        }

        JsonNode postback = event.path("postback");
        if (postback.isObject()) {
            out.add(MessageCandidate.builder()
                    .platform(platform)
                    .accountId(pageId)
                    .senderId(senderId)
                    .platformMessageId(postback.path("mid").asText(null))
                    .text(postback.path("title").asText(null))
                    .postbackPayload(postback.path("payload").asText(null))
                    .platformType(MessageCandidate.TYPE_POSTBACK)
                    .timestamp(timestamp)
                    .build());
        }
    }

    private void parseWhatsAppChange(JsonNode value, List<MessageCandidate> out) {
        String phoneNumberId = value.path("metadata").path("phone_number_id").asText(null);
        if (phoneNumberId == null) {
            log.warn("Skipping WhatsApp change without phone_number_id");
            return;
        }

        for (JsonNode message : value.path("messages")) {
            String from = message.path("from").asText(null);
            if (from == null) {
                log.warn("Skipping WhatsApp message without sender: account={}", phoneNumberId);
                continue;
            }
            String type = message.path("type").asText("text");
            JsonNode media = message.path(type);
            String text = message.path("text").path("body").asText(null);
            if (text == null && media.isObject()) {
                text = media.path("caption").asText(null);
            }

            out.add(MessageCandidate.builder()
                    .platform(Platform.WHATSAPP)
                    .accountId(phoneNumberId)
                    .senderId(from)
                    .senderName(contactName(value.path("contacts"), from))
                    .platformMessageId(message.path("id").asText(null))
                    .text(text)
                    .media("text".equals(type) || !media.isObject() ? null : media)
                    .platformType(type)
                    .timestamp(message.has("timestamp")
                            ? Instant.ofEpochSecond(message.path("timestamp").asLong())
                            : Instant.now(clock))
                    .build());
        }
    }

    private static String contactName(JsonNode contacts, String waId) {
        String fallback = null;
        for (JsonNode contact : contacts) {
            String name = contact.path("profile").path("name").asText(null);
            if (waId.equals(contact.path("wa_id").asText(null))) {
                return name;
            }
            if (fallback == null) {
                fallback = name;
            }
        }
        return fallback;
    }
}
