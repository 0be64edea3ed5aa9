package com.optionsterminal.api.controller;

import com.optionsterminal.api.dto.response.HealthResponse;
import com.optionsterminal.session.BrokerSession;
import com.optionsterminal.session.BrokerSessionManager;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET / and GET /health -- gateway status, session and feed state, pacing load</li>
 *   <li>GET /ping -- minimal reachability check</li>
 * </ul>
 *
 * <p>Neither endpoint touches the broker, so both answer while disconnected.
 */
@RestController
public class HealthController {

    private final BrokerSessionManager brokerSessionManager;
    private final Clock clock;

    @Value("${gateway.version:1.0.0}")
    private String version;

    public HealthController(BrokerSessionManager brokerSessionManager, Clock clock) {
        this.brokerSessionManager = brokerSessionManager;
        this.clock = clock;
    }

    @GetMapping({"/", "/health"})
    public ResponseEntity<HealthResponse> health() {
        Optional<BrokerSession> session = brokerSessionManager.currentSession();
        HealthResponse response = HealthResponse.builder()
                .status(HealthResponse.STATUS_ONLINE)
                .connected(session.isPresent())
                .feedLive(session.map(BrokerSession::isFeedLive).orElse(false))
                .subscriptions(session.map(BrokerSession::subscriptionCount).orElse(0))
                .tickCount(session.map(s -> s.getTickCache().size()).orElse(0))
                .restCallsMin(session.map(s -> s.getPacingQueue().callsLastMinute()).orElse(0))
                .queueDepth(session.map(s -> s.getPacingQueue().queueDepth()).orElse(0))
                .version(version)
                .timestamp(epochSeconds())
                .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/ping")
    public ResponseEntity<Map<String, Object>> ping() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("version", version);
        body.put("ts", epochSeconds());
        return ResponseEntity.ok(body);
    }

    private double epochSeconds() {
        return clock.millis() / 1000.0;
    }
}
