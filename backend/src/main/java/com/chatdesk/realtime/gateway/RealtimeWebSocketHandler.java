package com.chatdesk.realtime.gateway;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Adapts Spring's WebSocket callbacks to {@link RealtimeGatewayService}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

    private final RealtimeGatewayService gatewayService;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        gatewayService.open(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = connectionId(session);
        if (connectionId != null) {
            gatewayService.onText(connectionId, message.getPayload());
        }
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        String connectionId = connectionId(session);
        if (connectionId != null) {
            gatewayService.onPong(connectionId);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        String connectionId = connectionId(session);
        if (connectionId == null) {
            log.warn("WebSocket transport error before handshake completed: error={}", exception.getMessage());
            return;
        }
        gatewayService.onTransportError(connectionId, exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connectionId = connectionId(session);
        if (connectionId != null) {
            gatewayService.onClose(connectionId, status);
        }
    }

    private static String connectionId(WebSocketSession session) {
        return (String) session.getAttributes().get(RealtimeGatewayService.CONNECTION_ID_ATTRIBUTE);
    }
}
