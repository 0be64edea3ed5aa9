package com.optionsterminal.api.websocket;

import com.optionsterminal.domain.model.TickDelta;
import com.optionsterminal.domain.model.VersionStamp;
import com.optionsterminal.service.TickDeltaService;
import java.io.IOException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relay state machine for one observer. Each {@link #poll()} compares the current
 * (session, version) stamp with the last one sent: on change it pushes a full
 * {@code tick_update} frame; otherwise it counts the unchanged poll and pushes a heartbeat
 * on every Nth one. The first poll always pushes a {@code tick_update}.
 *
 * <p>A failed send moves the loop to {@link State#DISCONNECTED}, which is terminal.
 * Polls are driven by the caller's scheduler; the loop itself never sleeps.
 */
public class TickRelayLoop {

    private static final Logger log = LoggerFactory.getLogger(TickRelayLoop.class);

    public enum State {
        CONNECTED,
        DISCONNECTED
    }

    private final String observerId;
    private final TickDeltaService tickDeltaService;
    private final RelayFrameSink sink;
    private final int heartbeatEvery;
    private final Clock clock;

    private volatile State state = State.CONNECTED;
    private VersionStamp lastSent;
    private long unchangedPolls;

    public TickRelayLoop(
            String observerId, TickDeltaService tickDeltaService, RelayFrameSink sink, int heartbeatEvery, Clock clock) {
        if (heartbeatEvery < 1) {
            throw new IllegalArgumentException("heartbeatEvery must be at least 1, got " + heartbeatEvery);
        }
        this.observerId = observerId;
        this.tickDeltaService = tickDeltaService;
        this.sink = sink;
        this.heartbeatEvery = heartbeatEvery;
        this.clock = clock;
    }

    /**
     * Runs one iteration.
     *
     * @return the frame sent, or null if nothing was sent or the loop is disconnected
     */
    public synchronized RelayFrame poll() {
        if (state == State.DISCONNECTED) {
            return null;
        }
        VersionStamp current = tickDeltaService.currentStamp();
        if (current.equals(lastSent)) {
            unchangedPolls++;
            if (unchangedPolls % heartbeatEvery != 0) {
                return null;
            }
            return send(RelayFrame.heartbeat(tickDeltaService.isFeedLive(), now()));
        }

        TickDelta delta = tickDeltaService.currentDelta();
        RelayFrame frame = send(RelayFrame.tickUpdate(delta, now()));
        if (frame != null) {
            lastSent = delta.stamp();
        }
        return frame;
    }

    public void disconnect() {
        if (state != State.DISCONNECTED) {
            state = State.DISCONNECTED;
            log.debug("Relay loop for observer {} disconnected", observerId);
        }
    }

    public State getState() {
        return state;
    }

    public boolean isConnected() {
        return state == State.CONNECTED;
    }

    public String getObserverId() {
        return observerId;
    }

    private RelayFrame send(RelayFrame frame) {
        try {
            sink.send(frame);
            return frame;
        } catch (IOException | RuntimeException e) {
            log.info("Relay to observer {} failed, stopping: {}", observerId, e.getMessage());
            disconnect();
            return null;
        }
    }

    private double now() {
        return clock.millis() / 1000.0;
    }
}
