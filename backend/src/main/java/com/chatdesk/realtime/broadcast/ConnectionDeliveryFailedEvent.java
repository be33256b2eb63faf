package com.chatdesk.realtime.broadcast;

/**
 * Published when a write to a local socket fails. The gateway reacts by tearing the
 * connection down.
 */
public record ConnectionDeliveryFailedEvent(String connectionId, Throwable cause) {
}
