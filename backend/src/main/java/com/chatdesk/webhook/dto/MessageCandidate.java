package com.chatdesk.webhook.dto;

import com.chatdesk.socialconnection.domain.Platform;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * One inbound customer message extracted from a webhook delivery, normalised across
 * Messenger, Instagram and WhatsApp payloads.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"text", "attachments", "media"})
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessageCandidate {

    public static final String TYPE_MESSAGE = "message";
    public static final String TYPE_POSTBACK = "postback";

    private Platform platform;

    /** Page id (Messenger, Instagram) or phone number id (WhatsApp). */
    private String accountId;

    private String senderId;
    private String senderName;
    private String platformMessageId;
    private String text;

    /** Messenger attachment array as received. */
    private JsonNode attachments;

    /** WhatsApp media object (image, audio, document...) as received. */
    private JsonNode media;

    /** {@code message} or {@code postback} for Messenger, the message type for WhatsApp. */
    private String platformType;

    private String postbackPayload;
    private Instant timestamp;

    @JsonIgnore
    public boolean hasAttachments() {
        return attachments != null && attachments.isArray() && !attachments.isEmpty();
    }

    /**
     * Conversation name used when the platform does not supply one.
     */
    @JsonIgnore
    public String displayName() {
        if (senderName != null && !senderName.isBlank()) {
            return senderName;
        }
        String suffix = senderId.length() > 4 ? senderId.substring(senderId.length() - 4) : senderId;
        return "Customer " + suffix;
    }
}
