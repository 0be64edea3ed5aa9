package com.optionsterminal.session;

import com.optionsterminal.broker.BrokerClient;
import com.optionsterminal.broker.BrokerClientFactory;
import com.optionsterminal.broker.BrokerCredentials;
import com.optionsterminal.broker.PacingQueue;
import com.optionsterminal.config.GatewayProperties;
import com.optionsterminal.exception.NotConnectedException;
import com.optionsterminal.marketdata.TickCache;
import com.optionsterminal.oms.StrategyOrderOrchestrator;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the lifecycle of the gateway's broker session: one at a time, created on connect
 * and destroyed on disconnect. A new connect closes the previous session first, so its
 * pending calls fail fast and its cache and subscriptions are dropped.
 */
@Component
public class BrokerSessionManager {

    private static final Logger log = LoggerFactory.getLogger(BrokerSessionManager.class);

    static final String PACING_LANE_NAME = "broker-rest";

    private final BrokerClientFactory brokerClientFactory;
    private final StrategyOrderOrchestrator orchestrator;
    private final GatewayProperties properties;
    private final Clock clock;

    private final AtomicReference<BrokerSession> current = new AtomicReference<>();

    public BrokerSessionManager(
            BrokerClientFactory brokerClientFactory,
            StrategyOrderOrchestrator orchestrator,
            GatewayProperties properties,
            Clock clock) {
        this.brokerClientFactory = brokerClientFactory;
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Establishes a broker session with {@code credentials} and makes it current.
     *
     * @throws com.optionsterminal.exception.BrokerException if the broker refuses the credentials;
     *     the previous session, if any, is left untouched in that case
     */
    public synchronized SessionInfo connect(BrokerCredentials credentials) {
        log.info("Connecting broker session: {}", credentials);
        BrokerClient client = brokerClientFactory.createSession(credentials);

        BrokerSession previous = current.getAndSet(null);
        if (previous != null) {
            log.info("Replacing session {}", previous.getSessionId());
            previous.close();
        }

        BrokerSession session = new BrokerSession(
                UUID.randomUUID().toString(),
                client,
                new PacingQueue(PACING_LANE_NAME, properties.getPacing()),
                new TickCache(clock),
                orchestrator,
                properties,
                clock);
        session.start();
        current.set(session);

        Map<String, Object> details = session.customerDetails();
        log.info("Session {} connected, broker key {}", session.getSessionId(), session.maskedSessionKey());
        return SessionInfo.builder()
                .sessionId(session.getSessionId())
                .sessionKey(session.maskedSessionKey())
                .name(text(details.get("name")))
                .email(text(details.get("email")))
                .connectedAt(session.getConnectedAt())
                .build();
    }

    /** @return true if a session was open and has been closed */
    public synchronized boolean disconnect() {
        BrokerSession session = current.getAndSet(null);
        if (session == null) {
            return false;
        }
        session.close();
        log.info("Disconnected session {}", session.getSessionId());
        return true;
    }

    /** @throws NotConnectedException if no session is open */
    public BrokerSession requireSession() {
        BrokerSession session = current.get();
        if (session == null) {
            throw new NotConnectedException("Not connected; POST /api/connect first");
        }
        return session;
    }

    public Optional<BrokerSession> currentSession() {
        return Optional.ofNullable(current.get());
    }

    public boolean isConnected() {
        return current.get() != null;
    }

    @PreDestroy
    public void shutdown() {
        if (disconnect()) {
            log.info("Broker session closed on shutdown");
        }
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString();
    }
}
