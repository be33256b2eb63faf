package com.chatdesk.realtime.gateway;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open sockets on this instance keyed by connection id.
 */
@Component
public class ConnectionSessions {

    private final Map<String, GatewaySession> sessions = new ConcurrentHashMap<>();

    void add(GatewaySession session) {
        sessions.put(session.getConnectionId(), session);
    }

    Optional<GatewaySession> remove(String connectionId) {
        return Optional.ofNullable(sessions.remove(connectionId));
    }

    public Optional<GatewaySession> find(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    public Collection<GatewaySession> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    /**
     * @return false when no open socket is held for the id
     * @throws IOException when the write fails
     */
    public boolean send(String connectionId, TextMessage message) throws IOException {
        GatewaySession session = sessions.get(connectionId);
        if (session == null || !session.getSocket().isOpen()) {
            return false;
        }
        session.getSocket().sendMessage(message);
        return true;
    }
}
