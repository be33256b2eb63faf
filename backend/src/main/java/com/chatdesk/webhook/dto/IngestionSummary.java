package com.chatdesk.webhook.dto;

public record IngestionSummary(int candidates, int created, int duplicates, int unrouted, int failed) {

    public static IngestionSummary empty() {
        return new IngestionSummary(0, 0, 0, 0, 0);
    }
}
