package com.chatdesk.realtime.registry;

/**
 * Result of removing a connection from the registry.
 *
 * @param connection       the removed connection
 * @param userWentOffline  true when it was the user's last connection on this instance
 */
public record Disconnection(Connection connection, boolean userWentOffline) {
}
