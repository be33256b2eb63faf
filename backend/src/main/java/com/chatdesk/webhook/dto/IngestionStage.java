package com.chatdesk.webhook.dto;

/**
 * Pipeline stage a candidate was in when it failed.
 */
public enum IngestionStage {
    MATERIALIZATION,
    BROADCAST,
    REPLAY
}
