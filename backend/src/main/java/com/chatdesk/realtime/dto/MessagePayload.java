package com.chatdesk.realtime.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessagePayload {
    private UUID id;
    private String platformMessageId;
    private String text;
    private String type;
    private String sender;
    private String senderId;
    private String timestamp;
    private JsonNode attachments;
}
