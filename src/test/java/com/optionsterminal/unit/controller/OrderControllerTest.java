package com.optionsterminal.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.optionsterminal.api.controller.OrderController;
import com.optionsterminal.broker.BrokerClient;
import com.optionsterminal.broker.BrokerResponse;
import com.optionsterminal.broker.PacingQueue;
import com.optionsterminal.config.ApiResponseAdvice;
import com.optionsterminal.config.GatewayProperties;
import com.optionsterminal.domain.enums.OrderAction;
import com.optionsterminal.domain.model.OrderModification;
import com.optionsterminal.exception.GlobalExceptionHandler;
import com.optionsterminal.exception.NotConnectedException;
import com.optionsterminal.marketdata.TickCache;
import com.optionsterminal.oms.LegResult;
import com.optionsterminal.oms.OrderActionResult;
import com.optionsterminal.oms.OrderLeg;
import com.optionsterminal.oms.StrategyOrderOrchestrator;
import com.optionsterminal.session.BrokerSession;
import com.optionsterminal.session.BrokerSessionManager;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class OrderControllerTest {

    private static final String STRADDLE = """
            {
              "legs": [
                {"stock_code": "NIFTY", "action": "buy", "quantity": 75, "expiry_date": "28-Oct-2025",
                 "strike_price": 24500, "right": "Call"},
                {"stock_code": "NIFTY", "action": "buy", "quantity": 75, "expiry_date": "28-Oct-2025",
                 "strike_price": 24500, "right": "Put"}
              ]
            }
            """;

    private static final String IRON_LEGS_WITH_BAD_ACTION = """
            {
              "legs": [
                {"stock_code": "NIFTY", "action": "sell", "quantity": 75, "expiry_date": "28-Oct-2025",
                 "strike_price": 24500, "right": "Call"},
                {"stock_code": "NIFTY", "action": "hold", "quantity": 75, "expiry_date": "28-Oct-2025",
                 "strike_price": 24600, "right": "Call"},
                {"stock_code": "NIFTY", "action": "sell", "quantity": 75, "expiry_date": "28-Oct-2025",
                 "strike_price": 24500, "right": "Put"}
              ]
            }
            """;

    private MockMvc mockMvc;

    @Mock
    private BrokerSessionManager brokerSessionManager;

    @Mock
    private BrokerSession session;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new OrderController(brokerSessionManager))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Nested
    @DisplayName("Placement")
    class Placement {

        @Test
        @DisplayName("POST /api/strategy/execute returns one result per leg")
        void executeStrategy() throws Exception {
            when(brokerSessionManager.requireSession()).thenReturn(session);
            when(session.executeStrategy(anyList()))
                    .thenReturn(List.of(
                            LegResult.builder().legIndex(0).success(true).orderId("ORD-1").build(),
                            LegResult.failed(1, "Insufficient margin")));

            mockMvc.perform(post("/api/strategy/execute")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(STRADDLE))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.allSucceeded").value(false))
                    .andExpect(jsonPath("$.data.legCount").value(2))
                    .andExpect(jsonPath("$.data.failedCount").value(1))
                    .andExpect(jsonPath("$.data.results[0].order_id").value("ORD-1"))
                    .andExpect(jsonPath("$.data.results[1].leg_index").value(1))
                    .andExpect(jsonPath("$.data.results[1].error").value("Insufficient margin"));
        }

        @Test
        @DisplayName("POST /api/strategy/execute binds the good legs when one leg carries an unknown action")
        void unreadableLegIsBoundAsPlaceholder() throws Exception {
            when(brokerSessionManager.requireSession()).thenReturn(session);
            when(session.executeStrategy(anyList())).thenReturn(List.of(
                    LegResult.builder().legIndex(0).success(true).orderId("ORD-1").build(),
                    LegResult.failed(1, "Invalid value for action: Unknown order action: hold"),
                    LegResult.builder().legIndex(2).success(true).orderId("ORD-2").build()));

            mockMvc.perform(post("/api/strategy/execute")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(IRON_LEGS_WITH_BAD_ACTION))
                    .andExpect(status().isOk());

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<OrderLeg>> captor = ArgumentCaptor.forClass(List.class);
            verify(session).executeStrategy(captor.capture());
            List<OrderLeg> legs = captor.getValue();
            assertThat(legs).hasSize(3);
            assertThat(legs.get(0).isUnreadable()).isFalse();
            assertThat(legs.get(0).getAction()).isEqualTo(OrderAction.SELL);
            assertThat(legs.get(1).isUnreadable()).isTrue();
            assertThat(legs.get(1).getUnreadableReason()).contains("action").contains("hold");
            assertThat(legs.get(2).getStrikePrice()).isEqualByComparingTo("24500");
        }

        @Test
        @DisplayName("a leg with an unknown action fails alone while the other legs are placed")
        void unreadableLegFailsAlone() throws Exception {
            BrokerClient client = mock(BrokerClient.class);
            when(client.placeOrder(any()))
                    .thenReturn(BrokerResponse.ok(Map.of("order_id", "ORD-1")))
                    .thenReturn(BrokerResponse.ok(Map.of("order_id", "ORD-2")));
            PacingQueue pacingQueue = new PacingQueue("orders", 0, 10, 2_000, 100, 100);
            pacingQueue.start();
            BrokerSession realSession = new BrokerSession(
                    "session-1",
                    client,
                    pacingQueue,
                    new TickCache(Clock.systemUTC()),
                    new StrategyOrderOrchestrator(Runnable::run, 2_000),
                    new GatewayProperties(),
                    Clock.systemUTC());
            when(brokerSessionManager.requireSession()).thenReturn(realSession);

            try {
                mockMvc.perform(post("/api/strategy/execute")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(IRON_LEGS_WITH_BAD_ACTION))
                        .andExpect(status().isOk())
                        .andExpect(jsonPath("$.data.legCount").value(3))
                        .andExpect(jsonPath("$.data.failedCount").value(1))
                        .andExpect(jsonPath("$.data.results[0].success").value(true))
                        .andExpect(jsonPath("$.data.results[1].success").value(false))
                        .andExpect(jsonPath("$.data.results[1].error").value(containsString("hold")))
                        .andExpect(jsonPath("$.data.results[2].success").value(true));
            } finally {
                pacingQueue.shutdown();
            }

            verify(client, times(2)).placeOrder(any());
        }

        @Test
        @DisplayName("POST /api/strategy/execute with no legs is a validation error")
        void executeEmptyStrategy() throws Exception {
            mockMvc.perform(post("/api/strategy/execute")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"legs\": []}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

            verify(brokerSessionManager, never()).requireSession();
        }

        @Test
        @DisplayName("POST /api/order binds the leg and returns a broker rejection as success=false")
        void placeSingleOrder() throws Exception {
            when(brokerSessionManager.requireSession()).thenReturn(session);
            when(session.placeOrder(any())).thenReturn(LegResult.failed(0, "Market closed"));

            mockMvc.perform(post("/api/order")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"stockCode": "NIFTY", "action": "sell", "quantity": 75,
                                     "expiryDate": "28-Oct-2025", "strikePrice": 24600, "right": "CE"}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.success").value(false))
                    .andExpect(jsonPath("$.data.error").value("Market closed"));

            ArgumentCaptor<OrderLeg> captor = ArgumentCaptor.forClass(OrderLeg.class);
            verify(session).placeOrder(captor.capture());
            assertThat(captor.getValue().getAction()).isEqualTo(OrderAction.SELL);
            assertThat(captor.getValue().getStrikePrice()).isEqualByComparingTo("24600");
        }

        @Test
        @DisplayName("orders while disconnected are rejected with 401")
        void notConnected() throws Exception {
            when(brokerSessionManager.requireSession()).thenThrow(new NotConnectedException("Not connected to broker"));

            mockMvc.perform(post("/api/strategy/execute")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(STRADDLE))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("NOT_CONNECTED"));
        }
    }

    @Nested
    @DisplayName("Order management")
    class Management {

        @Test
        @DisplayName("POST /api/order/cancel defaults the exchange to NFO")
        void cancel() throws Exception {
            when(brokerSessionManager.requireSession()).thenReturn(session);
            when(session.cancelOrder("ORD-9", "NFO")).thenReturn(OrderActionResult.builder().success(true).build());

            mockMvc.perform(post("/api/order/cancel")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"order_id\": \"ORD-9\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.success").value(true));
        }

        @Test
        @DisplayName("POST /api/order/cancel without an order id is a validation error")
        void cancelWithoutOrderId() throws Exception {
            mockMvc.perform(post("/api/order/cancel")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.details.orderId").exists());
        }

        @Test
        @DisplayName("PATCH /api/order/modify passes the changes through")
        void modify() throws Exception {
            when(brokerSessionManager.requireSession()).thenReturn(session);
            when(session.modifyOrder(any())).thenReturn(OrderActionResult.failed("Order ORD-9 is not open"));

            mockMvc.perform(patch("/api/order/modify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"orderId\": \"ORD-9\", \"price\": \"12.5\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.success").value(false))
                    .andExpect(jsonPath("$.data.error").value("Order ORD-9 is not open"));

            ArgumentCaptor<OrderModification> captor = ArgumentCaptor.forClass(OrderModification.class);
            verify(session).modifyOrder(captor.capture());
            assertThat(captor.getValue().getOrderId()).isEqualTo("ORD-9");
            assertThat(captor.getValue().getPrice()).isEqualTo("12.5");
            assertThat(captor.getValue().getValidity()).isEqualTo("day");
        }

        @Test
        @DisplayName("GET /api/orders returns the broker's order book")
        void orderBook() throws Exception {
            when(brokerSessionManager.requireSession()).thenReturn(session);
            when(session.orderBook()).thenReturn(List.of(Map.of("order_id", "ORD-1", "status", "Executed")));

            mockMvc.perform(get("/api/orders"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data[0].order_id").value("ORD-1"))
                    .andExpect(jsonPath("$.data[0].status").value("Executed"));
        }
    }
}
