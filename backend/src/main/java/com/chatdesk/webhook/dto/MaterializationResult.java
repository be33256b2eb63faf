package com.chatdesk.webhook.dto;

import com.chatdesk.chat.domain.Chat;
import com.chatdesk.message.domain.MessageType;

import java.util.UUID;

/**
 * Outcome of storing one candidate.
 *
 * @param chat        the conversation, null when unrouted
 * @param messageId   id of the inserted message, null unless created
 * @param messageType stored message type, null unless created
 */
public record MaterializationResult(Status status, Chat chat, boolean chatCreated,
                                    UUID messageId, MessageType messageType) {

    public enum Status {
        CREATED,
        DUPLICATE,
        UNROUTED
    }

    public static MaterializationResult created(Chat chat, boolean chatCreated, UUID messageId, MessageType type) {
        return new MaterializationResult(Status.CREATED, chat, chatCreated, messageId, type);
    }

    public static MaterializationResult duplicate(Chat chat) {
        return new MaterializationResult(Status.DUPLICATE, chat, false, null, null);
    }

    public static MaterializationResult unrouted() {
        return new MaterializationResult(Status.UNROUTED, null, false, null, null);
    }

    public boolean isCreated() {
        return status == Status.CREATED;
    }
}
