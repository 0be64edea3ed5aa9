package com.optionsterminal.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.optionsterminal.api.websocket.TickRelayHandler;
import com.optionsterminal.domain.model.TickUpdate;
import com.optionsterminal.marketdata.TickCache;
import com.optionsterminal.observability.GatewayMetrics;
import com.optionsterminal.session.BrokerSession;
import com.optionsterminal.session.BrokerSessionManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GatewayMetricsTest {

    @Mock
    private BrokerSessionManager brokerSessionManager;

    @Mock
    private TickRelayHandler tickRelayHandler;

    private SimpleMeterRegistry registry;

    // Gauges hold their state object weakly
    private GatewayMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new GatewayMetrics(registry, brokerSessionManager, tickRelayHandler);
    }

    private double gauge(String name) {
        return registry.get(name).gauge().value();
    }

    @Test
    @DisplayName("session gauges read 0 while disconnected")
    void zeroWithoutSession() {
        when(brokerSessionManager.currentSession()).thenReturn(Optional.empty());
        when(brokerSessionManager.isConnected()).thenReturn(false);
        when(tickRelayHandler.observerCount()).thenReturn(2);

        assertThat(gauge("pacing.queue.depth")).isZero();
        assertThat(gauge("tick.cache.version")).isZero();
        assertThat(gauge("session.connected")).isZero();
        assertThat(gauge("relay.observers")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("session gauges follow the current session")
    void followCurrentSession() {
        TickCache tickCache = new TickCache(Clock.systemUTC());
        tickCache.update("NIFTY:24500:CE", TickUpdate.builder().ltp(120.0).build());
        tickCache.update("NIFTY:SPOT", TickUpdate.builder().ltp(24500.0).build());
        BrokerSession session = mock(BrokerSession.class);
        when(session.getTickCache()).thenReturn(tickCache);
        when(session.isFeedLive()).thenReturn(true);
        when(session.subscriptionCount()).thenReturn(6);
        when(brokerSessionManager.currentSession()).thenReturn(Optional.of(session));
        when(brokerSessionManager.isConnected()).thenReturn(true);

        assertThat(gauge("tick.cache.version")).isEqualTo(2.0);
        assertThat(gauge("tick.cache.size")).isEqualTo(2.0);
        assertThat(gauge("feed.subscriptions")).isEqualTo(6.0);
        assertThat(gauge("feed.live")).isEqualTo(1.0);
        assertThat(gauge("session.connected")).isEqualTo(1.0);
    }
}
