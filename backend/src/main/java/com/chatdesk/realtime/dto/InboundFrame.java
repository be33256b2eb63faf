package com.chatdesk.realtime.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Optional;
import java.util.UUID;

/**
 * Raw client frame: {@code {"type": "...", "data": {...}}}.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundFrame {
    private String type;
    private JsonNode data;

    public Optional<String> textField(String name) {
        if (data == null || !data.hasNonNull(name)) {
            return Optional.empty();
        }
        String value = data.get(name).asText();
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    /**
     * @throws IllegalArgumentException if the field is present but not a UUID
     */
    public Optional<UUID> uuidField(String name) {
        return textField(name).map(UUID::fromString);
    }
}
