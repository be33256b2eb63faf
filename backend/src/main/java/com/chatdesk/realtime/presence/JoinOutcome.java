package com.chatdesk.realtime.presence;

import com.chatdesk.realtime.dto.RealtimeEvent;

/**
 * Result of a join attempt. {@code reply} is the event to send back to the requesting
 * connection: a room-joined confirmation when granted, an error otherwise.
 */
public record JoinOutcome(boolean granted, RealtimeEvent reply) {

    public static JoinOutcome granted(RealtimeEvent confirmation) {
        return new JoinOutcome(true, confirmation);
    }

    public static JoinOutcome denied(RealtimeEvent error) {
        return new JoinOutcome(false, error);
    }
}
