package com.optionsterminal.api.controller;

import com.optionsterminal.api.dto.request.ConnectRequest;
import com.optionsterminal.api.dto.response.ConnectResponse;
import com.optionsterminal.broker.BrokerCredentials;
import com.optionsterminal.session.BrokerSessionManager;
import com.optionsterminal.session.SessionInfo;
import jakarta.validation.Valid;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Broker session lifecycle.
 *
 * <ul>
 *   <li>POST /api/connect -- open a session, replacing any current one</li>
 *   <li>POST /api/disconnect -- close the current session; idempotent</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final BrokerSessionManager brokerSessionManager;

    public SessionController(BrokerSessionManager brokerSessionManager) {
        this.brokerSessionManager = brokerSessionManager;
    }

    @PostMapping("/connect")
    public ResponseEntity<ConnectResponse> connect(@Valid @RequestBody ConnectRequest request) {
        BrokerCredentials credentials = request.toCredentials();
        log.info("Connect requested with {}", credentials);
        SessionInfo info = brokerSessionManager.connect(credentials);
        return ResponseEntity.ok(ConnectResponse.from(info));
    }

    @PostMapping("/disconnect")
    public ResponseEntity<Map<String, Object>> disconnect() {
        boolean closed = brokerSessionManager.disconnect();
        return ResponseEntity.ok(Map.of(
                "disconnected", closed, "message", closed ? "Session closed" : "No active session"));
    }
}
