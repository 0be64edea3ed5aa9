package com.optionsterminal.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.optionsterminal.api.dto.response.TickPollResponse;
import com.optionsterminal.broker.BrokerClient;
import com.optionsterminal.broker.PacingQueue;
import com.optionsterminal.config.GatewayProperties;
import com.optionsterminal.domain.model.TickDelta;
import com.optionsterminal.domain.model.TickUpdate;
import com.optionsterminal.domain.model.VersionStamp;
import com.optionsterminal.marketdata.TickCache;
import com.optionsterminal.oms.StrategyOrderOrchestrator;
import com.optionsterminal.service.TickDeltaService;
import com.optionsterminal.session.BrokerSession;
import com.optionsterminal.session.BrokerSessionManager;
import java.time.Clock;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TickDeltaServiceTest {

    @Mock
    private BrokerSessionManager brokerSessionManager;

    private TickDeltaService tickDeltaService;

    @BeforeEach
    void setUp() {
        tickDeltaService = new TickDeltaService(brokerSessionManager);
    }

    static BrokerSession session(String sessionId) {
        Clock clock = Clock.systemUTC();
        return new BrokerSession(
                sessionId,
                mock(BrokerClient.class),
                new PacingQueue("test", 0, 10, 1_000, 100, 100),
                new TickCache(clock),
                new StrategyOrderOrchestrator(Runnable::run, 1_000),
                new GatewayProperties(),
                clock);
    }

    @Nested
    @DisplayName("Without a session")
    class NoSession {

        @Test
        @DisplayName("reports an empty delta at version 0")
        void emptyDelta() {
            when(brokerSessionManager.currentSession()).thenReturn(Optional.empty());

            TickDelta delta = tickDeltaService.currentDelta();

            assertThat(delta.getVersion()).isZero();
            assertThat(delta.getTicks()).isEmpty();
            assertThat(delta.getSpotPrices()).isEmpty();
            assertThat(tickDeltaService.currentStamp()).isEqualTo(VersionStamp.NO_SESSION);
            assertThat(tickDeltaService.poll(0).isChanged()).isFalse();
        }
    }

    @Nested
    @DisplayName("With a session")
    class WithSession {

        private BrokerSession session;

        @BeforeEach
        void setUp() {
            session = session("s-1");
            when(brokerSessionManager.currentSession()).thenReturn(Optional.of(session));
        }

        @Test
        @DisplayName("delta rows and spot prices come from one snapshot")
        void deltaFromSnapshot() {
            session.getTickCache().update("NIFTY:21500:CE", TickUpdate.builder().ltp(100.0).build());
            session.getTickCache().update("NIFTY:SPOT", TickUpdate.builder().ltp(21512.0).build());

            TickDelta delta = tickDeltaService.currentDelta();

            assertThat(delta.getSessionId()).isEqualTo("s-1");
            assertThat(delta.getVersion()).isEqualTo(2);
            assertThat(delta.getTicks()).hasSize(1);
            assertThat(delta.getSpotPrices()).containsEntry("NIFTY", 21512.0);
            assertThat(delta.isFeedLive()).isFalse();
            assertThat(delta.stamp()).isEqualTo(new VersionStamp("s-1", 2));
        }

        @Test
        @DisplayName("poll answers unchanged only for the current version")
        void pollComparesVersion() {
            session.getTickCache().update("NIFTY:21500:CE", TickUpdate.builder().ltp(100.0).build());

            TickPollResponse stale = tickDeltaService.poll(0);
            TickPollResponse current = tickDeltaService.poll(1);
            TickPollResponse ahead = tickDeltaService.poll(7);

            assertThat(stale.isChanged()).isTrue();
            assertThat(stale.getTicks()).hasSize(1);
            assertThat(current.isChanged()).isFalse();
            assertThat(current.getVersion()).isEqualTo(1);
            assertThat(current.getTicks()).isNull();
            assertThat(ahead.isChanged()).isTrue();
        }
    }
}
