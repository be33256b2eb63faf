package com.chatdesk.common.controller;

import com.chatdesk.realtime.gateway.ConnectionSessions;
import com.chatdesk.realtime.registry.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private static final Map<String, String> HOME_RESPONSE = Map.of(
            "message", "Chatdesk realtime backend is running!",
            "status", "ok"
    );

    private final ConnectionSessions connectionSessions;
    private final ConnectionRegistry connectionRegistry;

    @GetMapping("/")
    public Map<String, String> home() {
        return HOME_RESPONSE;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("openSockets", connectionSessions.size());
        body.put("authenticatedConnections", connectionRegistry.connectionCount());
        return body;
    }
}
