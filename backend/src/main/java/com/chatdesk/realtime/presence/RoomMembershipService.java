package com.chatdesk.realtime.presence;

import com.chatdesk.chat.service.ChatPermissionService;
import com.chatdesk.realtime.dto.OutboundEventType;
import com.chatdesk.realtime.dto.RealtimeErrorCode;
import com.chatdesk.realtime.dto.RealtimeEvent;
import com.chatdesk.realtime.registry.Connection;
import com.chatdesk.realtime.registry.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which connections have joined which conversation rooms on this instance.
 * A connection is added to a room only after the permission check passes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomMembershipService {

    private final ConnectionRegistry connectionRegistry;
    private final ChatPermissionService chatPermissionService;
    private final Clock clock;

    private final Map<UUID, Set<String>> rooms = new ConcurrentHashMap<>();

    public JoinOutcome join(String connectionId, UUID chatId) {
        Optional<Connection> found = connectionRegistry.get(connectionId);
        if (found.isEmpty()) {
            return JoinOutcome.denied(RealtimeEvent.error(RealtimeErrorCode.UNAUTHORIZED, "Not authenticated", clock.instant()));
        }
        Connection connection = found.get();

        if (!chatPermissionService.canAccessChat(connection.getUserId(), connection.getTenantId(), chatId)) {
            return JoinOutcome.denied(RealtimeEvent.error(RealtimeErrorCode.ACCESS_DENIED, "Access denied to this chat", clock.instant()));
        }

        synchronized (this) {
            // The connection may have been torn down while the permission query ran.
            if (connectionRegistry.get(connectionId).isEmpty()) {
                return JoinOutcome.denied(RealtimeEvent.error(RealtimeErrorCode.UNAUTHORIZED, "Not authenticated", clock.instant()));
            }
            connection.addRoom(chatId);
            rooms.computeIfAbsent(chatId, id -> ConcurrentHashMap.newKeySet()).add(connectionId);
        }

        log.debug("Joined room: connectionId={}, chat={}", connectionId, chatId);
        return JoinOutcome.granted(RealtimeEvent.forChat(OutboundEventType.ROOM_JOINED, chatId, clock.instant()));
    }

    /**
     * Idempotent: leaving a room the connection is not in still yields the confirmation.
     */
    public RealtimeEvent leave(String connectionId, UUID chatId) {
        synchronized (this) {
            connectionRegistry.get(connectionId).ifPresent(connection -> connection.removeRoom(chatId));
            removeMember(chatId, connectionId);
        }
        log.debug("Left room: connectionId={}, chat={}", connectionId, chatId);
        return RealtimeEvent.forChat(OutboundEventType.ROOM_LEFT, chatId, clock.instant());
    }

    /**
     * Removes the connection from every room on this instance. Runs after the connection is
     * unregistered, so a join still waiting on its permission query fails its re-check instead
     * of adding a member nobody will remove.
     */
    public synchronized void leaveAll(String connectionId) {
        Iterator<Map.Entry<UUID, Set<String>>> entries = rooms.entrySet().iterator();
        while (entries.hasNext()) {
            Set<String> members = entries.next().getValue();
            members.remove(connectionId);
            if (members.isEmpty()) {
                entries.remove();
            }
        }
        connectionRegistry.get(connectionId).ifPresent(connection -> connection.getRooms().forEach(connection::removeRoom));
    }

    public Set<String> roomMembers(UUID chatId) {
        Set<String> members = rooms.get(chatId);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    public boolean isMember(String connectionId, UUID chatId) {
        Set<String> members = rooms.get(chatId);
        return members != null && members.contains(connectionId);
    }

    public int roomCount() {
        return rooms.size();
    }

    private void removeMember(UUID chatId, String connectionId) {
        Set<String> members = rooms.get(chatId);
        if (members == null) {
            return;
        }
        members.remove(connectionId);
        if (members.isEmpty()) {
            rooms.remove(chatId);
        }
    }
}
