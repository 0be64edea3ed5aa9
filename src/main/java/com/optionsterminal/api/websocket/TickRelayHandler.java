package com.optionsterminal.api.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.optionsterminal.config.GatewayProperties;
import com.optionsterminal.service.TickDeltaService;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket endpoint for tick observers ({@code /ws/ticks}).
 *
 * <p>Each connection gets its own {@link TickRelayLoop}, polled at a fixed delay on the
 * shared relay scheduler, so a slow observer only delays its own frames. The loop is
 * cancelled when the connection closes or a send fails.
 */
@Component
public class TickRelayHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TickRelayHandler.class);

    private final TickDeltaService tickDeltaService;
    private final TaskScheduler relayScheduler;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final Clock clock;

    private final Map<String, Observer> observers = new ConcurrentHashMap<>();

    public TickRelayHandler(
            TickDeltaService tickDeltaService,
            @Qualifier("relayScheduler") TaskScheduler relayScheduler,
            ObjectMapper objectMapper,
            GatewayProperties properties,
            Clock clock) {
        this.tickDeltaService = tickDeltaService;
        this.relayScheduler = relayScheduler;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        TickRelayLoop loop = new TickRelayLoop(
                session.getId(),
                tickDeltaService,
                frame -> sendFrame(session, frame),
                properties.getRelay().getHeartbeatEvery(),
                clock);
        Duration interval = Duration.ofMillis(properties.getRelay().getPollIntervalMs());
        ScheduledFuture<?> task = relayScheduler.scheduleWithFixedDelay(
                () -> runLoop(session, loop), Instant.now(clock).plus(interval), interval);
        observers.put(session.getId(), new Observer(loop, task));
        log.info("Tick observer {} connected from {}, {} active", session.getId(), session.getRemoteAddress(),
                observers.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Observer observer = observers.remove(session.getId());
        if (observer != null) {
            observer.stop();
        }
        log.info("Tick observer {} disconnected ({}), {} active", session.getId(), status, observers.size());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error for tick observer {}: {}", session.getId(), exception.getMessage());
        Observer observer = observers.remove(session.getId());
        if (observer != null) {
            observer.stop();
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // Observers are receive-only; inbound messages (client keepalives) are ignored
        log.debug("Ignoring message from tick observer {}", session.getId());
    }

    public int observerCount() {
        return observers.size();
    }

    private void runLoop(WebSocketSession session, TickRelayLoop loop) {
        try {
            loop.poll();
        } catch (RuntimeException e) {
            // An exception escaping a fixed-delay task would silently end its schedule
            log.warn("Relay poll for observer {} failed: {}", session.getId(), e.getMessage());
        }
        if (!loop.isConnected()) {
            Observer observer = observers.remove(session.getId());
            if (observer != null) {
                observer.stop();
            }
            closeSession(session);
        }
    }

    private void sendFrame(WebSocketSession session, RelayFrame frame) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("session closed");
        }
        String json = objectMapper.writeValueAsString(frame);
        synchronized (session) {
            session.sendMessage(new TextMessage(json));
        }
    }

    private void closeSession(WebSocketSession session) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.SERVER_ERROR);
        } catch (IOException e) {
            log.debug("Closing tick observer {} failed: {}", session.getId(), e.getMessage());
        }
    }

    private record Observer(TickRelayLoop loop, ScheduledFuture<?> task) {

        void stop() {
            loop.disconnect();
            task.cancel(false);
        }
    }
}
