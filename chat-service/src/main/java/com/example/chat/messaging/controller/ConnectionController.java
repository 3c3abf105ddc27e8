package com.example.chat.messaging.controller;

import com.example.chat.messaging.session.SessionInfo;
import com.example.chat.messaging.session.SessionRegistry;
import com.example.chat.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the sessions registered on this node.
 */
@RestController
@RequestMapping("/api/chat/connections")
@RequiredArgsConstructor
public class ConnectionController {

    private final SessionRegistry sessionRegistry;
    private final AppProperties appProperties;

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        List<SessionInfo> sessions = sessionRegistry.snapshot();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("node", appProperties.getNodeName());
        stats.put("connectedUsers", sessions.size());
        stats.put("sessions", sessions);
        return ResponseEntity.ok(stats);
    }

    @GetMapping("/{userId}")
    public ResponseEntity<Map<String, Object>> getUserConnection(@PathVariable String userId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", userId);
        sessionRegistry.describe(userId).ifPresentOrElse(
                info -> {
                    body.put("online", true);
                    body.put("session", info);
                },
                () -> body.put("online", false));
        return ResponseEntity.ok(body);
    }
}
