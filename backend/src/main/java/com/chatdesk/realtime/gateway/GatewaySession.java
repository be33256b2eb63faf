package com.chatdesk.realtime.gateway;

import com.chatdesk.auth.AuthenticatedPrincipal;
import lombok.Getter;
import org.springframework.web.socket.WebSocketSession;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-socket state held by the gateway, from handshake until close.
 * State transitions happen while holding the session's monitor.
 */
public class GatewaySession {

    @Getter
    private final String connectionId;
    @Getter
    private final WebSocketSession socket;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private volatile ScheduledFuture<?> authenticationDeadline;
    @Getter
    private volatile AuthenticatedPrincipal principal;

    public GatewaySession(String connectionId, WebSocketSession socket) {
        this.connectionId = connectionId;
        this.socket = socket;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isAuthenticated() {
        return state.get() == ConnectionState.AUTHENTICATED;
    }

    boolean transition(ConnectionState from, ConnectionState to) {
        return state.compareAndSet(from, to);
    }

    /**
     * Takes the session monitor, so it cannot interleave with an authentication that is
     * registering the connection.
     *
     * @return false if the session was already closed
     */
    synchronized boolean markClosed() {
        return state.getAndSet(ConnectionState.CLOSED) != ConnectionState.CLOSED;
    }

    void setAuthenticationDeadline(ScheduledFuture<?> deadline) {
        this.authenticationDeadline = deadline;
    }

    void cancelAuthenticationDeadline() {
        ScheduledFuture<?> deadline = authenticationDeadline;
        if (deadline != null) {
            deadline.cancel(false);
        }
    }

    void setPrincipal(AuthenticatedPrincipal principal) {
        this.principal = principal;
    }
}
