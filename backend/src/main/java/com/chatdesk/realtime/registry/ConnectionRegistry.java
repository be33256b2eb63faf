package com.chatdesk.realtime.registry;

import com.chatdesk.config.RealtimeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local index of authenticated connections by id, user and tenant.
 * Conversation rooms are tracked separately by
 * {@link com.chatdesk.realtime.presence.RoomMembershipService}.
 *
 * Buckets only ever hold ids present in the connection map. Register and unregister are
 * synchronized so the per-user cap check and the index updates happen as one step;
 * reads go straight to the concurrent maps.
 */
@Slf4j
@Component
public class ConnectionRegistry {

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<UUID, Set<String>> userConnections = new ConcurrentHashMap<>();
    private final Map<UUID, Set<String>> tenantConnections = new ConcurrentHashMap<>();

    private final int maxConnectionsPerUser;
    private final Clock clock;

    @Autowired
    public ConnectionRegistry(RealtimeProperties properties, Clock clock) {
        this(properties.getMaxConnectionsPerUser(), clock);
    }

    public ConnectionRegistry(int maxConnectionsPerUser, Clock clock) {
        this.maxConnectionsPerUser = maxConnectionsPerUser;
        this.clock = clock;
    }

    /**
     * @throws ConnectionLimitExceededException when the user already holds the maximum
     * @throws IllegalStateException when the id is already registered
     */
    public synchronized Connection register(String connectionId, UUID userId, UUID tenantId) {
        if (connections.containsKey(connectionId)) {
            throw new IllegalStateException("Connection already registered: " + connectionId);
        }
        if (userConnectionCount(userId) >= maxConnectionsPerUser) {
            log.warn("Connection limit reached: user={}, limit={}", userId, maxConnectionsPerUser);
            throw new ConnectionLimitExceededException(userId, maxConnectionsPerUser);
        }

        Connection connection = new Connection(connectionId, userId, tenantId, clock.instant());
        connections.put(connectionId, connection);
        userConnections.computeIfAbsent(userId, id -> ConcurrentHashMap.newKeySet()).add(connectionId);
        tenantConnections.computeIfAbsent(tenantId, id -> ConcurrentHashMap.newKeySet()).add(connectionId);

        log.info("Connection registered: connectionId={}, user={}, tenant={}", connectionId, userId, tenantId);
        return connection;
    }

    /**
     * Removes the connection from the user and tenant indices. Unknown ids yield empty.
     */
    public synchronized Optional<Disconnection> unregister(String connectionId) {
        Connection connection = connections.remove(connectionId);
        if (connection == null) {
            return Optional.empty();
        }

        boolean lastForUser = removeFromBucket(userConnections, connection.getUserId(), connectionId);
        removeFromBucket(tenantConnections, connection.getTenantId(), connectionId);

        log.info("Connection unregistered: connectionId={}, user={}, userWentOffline={}",
                connectionId, connection.getUserId(), lastForUser);
        return Optional.of(new Disconnection(connection, lastForUser));
    }

    public void touch(String connectionId) {
        Connection connection = connections.get(connectionId);
        if (connection != null) {
            connection.touch(clock.instant());
        }
    }

    /**
     * Ids of connections not seen since {@code now - timeout}. Performs no I/O and removes nothing.
     */
    public List<String> sweep(Instant now, Duration timeout) {
        Instant threshold = now.minus(timeout);
        return connections.values().stream()
                .filter(connection -> connection.getLastSeen().isBefore(threshold))
                .map(Connection::getId)
                .collect(Collectors.toList());
    }

    public Optional<Connection> get(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Set<String> connectionsOfUser(UUID userId) {
        return snapshot(userConnections.get(userId));
    }

    public Set<String> connectionsOfTenant(UUID tenantId) {
        return snapshot(tenantConnections.get(tenantId));
    }

    public Set<String> connectionIds() {
        return Set.copyOf(connections.keySet());
    }

    public int connectionCount() {
        return connections.size();
    }

    public int userConnectionCount(UUID userId) {
        Set<String> bucket = userConnections.get(userId);
        return bucket == null ? 0 : bucket.size();
    }

    public int getMaxConnectionsPerUser() {
        return maxConnectionsPerUser;
    }

    private static Set<String> snapshot(Collection<String> bucket) {
        return bucket == null ? Set.of() : Set.copyOf(bucket);
    }

    /**
     * @return true when the bucket became empty and was dropped
     */
    private static boolean removeFromBucket(Map<UUID, Set<String>> index, UUID key, String connectionId) {
        Set<String> bucket = index.get(key);
        if (bucket == null) {
            return true;
        }
        bucket.remove(connectionId);
        if (bucket.isEmpty()) {
            index.remove(key);
            return true;
        }
        return false;
    }
}
