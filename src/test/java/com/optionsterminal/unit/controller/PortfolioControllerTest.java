package com.optionsterminal.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.optionsterminal.api.controller.PortfolioController;
import com.optionsterminal.broker.RateStatus;
import com.optionsterminal.config.ApiResponseAdvice;
import com.optionsterminal.config.GatewayProperties;
import com.optionsterminal.domain.model.HistoricalQuery;
import com.optionsterminal.domain.model.PortfolioSnapshot;
import com.optionsterminal.exception.GlobalExceptionHandler;
import com.optionsterminal.exception.NotConnectedException;
import com.optionsterminal.session.BrokerSession;
import com.optionsterminal.session.BrokerSessionManager;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class PortfolioControllerTest {

    private MockMvc mockMvc;

    @Mock
    private BrokerSessionManager brokerSessionManager;

    @Mock
    private BrokerSession session;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PortfolioController(brokerSessionManager, new GatewayProperties()))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("GET /api/ratelimit reports configured limits while disconnected")
    void rateLimitIdle() throws Exception {
        when(brokerSessionManager.currentSession()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/ratelimit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.callsLastMinute").value(0))
                .andExpect(jsonPath("$.data.maxPerMinute").value(100))
                .andExpect(jsonPath("$.data.minIntervalMs").value(600))
                .andExpect(jsonPath("$.data.queueDepth").value(0));
    }

    @Test
    @DisplayName("GET /api/ratelimit reports the session's pacing lane")
    void rateLimitConnected() throws Exception {
        when(session.rateStatus())
                .thenReturn(RateStatus.builder()
                        .callsLastMinute(42)
                        .maxPerMinute(100)
                        .minIntervalMs(600)
                        .queueDepth(3)
                        .build());
        when(brokerSessionManager.currentSession()).thenReturn(Optional.of(session));

        mockMvc.perform(get("/api/ratelimit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.callsLastMinute").value(42))
                .andExpect(jsonPath("$.data.queueDepth").value(3));
    }

    @Test
    @DisplayName("GET /api/positions returns positions and holdings")
    void positions() throws Exception {
        when(brokerSessionManager.requireSession()).thenReturn(session);
        when(session.positions())
                .thenReturn(PortfolioSnapshot.builder()
                        .positions(List.of(Map.of("stock_code", "NIFTY", "quantity", "75")))
                        .holdings(List.of())
                        .build());

        mockMvc.perform(get("/api/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.positions[0].stock_code").value("NIFTY"))
                .andExpect(jsonPath("$.data.holdings").isEmpty());
    }

    @Test
    @DisplayName("GET /api/funds while disconnected is rejected with 401")
    void fundsNotConnected() throws Exception {
        when(brokerSessionManager.requireSession()).thenThrow(new NotConnectedException("Not connected to broker"));

        mockMvc.perform(get("/api/funds"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error.code").value("NOT_CONNECTED"));
    }

    @Test
    @DisplayName("GET /api/historical defaults to daily candles")
    void historicalDefaults() throws Exception {
        when(brokerSessionManager.requireSession()).thenReturn(session);
        when(session.historical(any())).thenReturn(List.of(Map.of("close", 24500.0)));

        mockMvc.perform(get("/api/historical")
                        .param("stock_code", "NIFTY")
                        .param("exchange_code", "NSE")
                        .param("from_date", "2025-10-01")
                        .param("to_date", "2025-10-27"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].close").value(24500.0));

        ArgumentCaptor<HistoricalQuery> captor = ArgumentCaptor.forClass(HistoricalQuery.class);
        verify(session).historical(captor.capture());
        assertThat(captor.getValue().getInterval()).isEqualTo("1day");
        assertThat(captor.getValue().isOptionContract()).isFalse();
    }
}
