package com.chatdesk.realtime.registry;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An authenticated client connection held by this instance. Never persisted.
 */
@Getter
public class Connection {

    private final String id;
    private final UUID userId;
    private final UUID tenantId;
    private final Instant createdAt;
    private volatile Instant lastSeen;
    private final Set<UUID> rooms = ConcurrentHashMap.newKeySet();

    public Connection(String id, UUID userId, UUID tenantId, Instant now) {
        this.id = id;
        this.userId = userId;
        this.tenantId = tenantId;
        this.createdAt = now;
        this.lastSeen = now;
    }

    void touch(Instant now) {
        this.lastSeen = now;
    }

    public boolean isInRoom(UUID chatId) {
        return rooms.contains(chatId);
    }

    public Set<UUID> getRooms() {
        return Collections.unmodifiableSet(rooms);
    }

    public boolean addRoom(UUID chatId) {
        return rooms.add(chatId);
    }

    public boolean removeRoom(UUID chatId) {
        return rooms.remove(chatId);
    }
}
