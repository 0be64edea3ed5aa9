package com.optionsterminal.api.controller;

import com.optionsterminal.api.dto.request.CancelOrderRequest;
import com.optionsterminal.api.dto.request.ModifyOrderRequest;
import com.optionsterminal.api.dto.request.StrategyExecuteRequest;
import com.optionsterminal.api.dto.response.StrategyExecutionResponse;
import com.optionsterminal.oms.LegResult;
import com.optionsterminal.oms.OrderActionResult;
import com.optionsterminal.oms.OrderLeg;
import com.optionsterminal.session.BrokerSession;
import com.optionsterminal.session.BrokerSessionManager;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Order placement and order management.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/order -- one leg, through the same path as a strategy</li>
 *   <li>POST /api/strategy/execute -- all legs concurrently, one result per leg</li>
 *   <li>POST /api/squareoff -- close a position with the opposite action</li>
 *   <li>POST /api/order/cancel -- cancel an open order</li>
 *   <li>PATCH /api/order/modify -- modify an open order</li>
 *   <li>GET /api/orders -- today's order book</li>
 *   <li>GET /api/trades -- today's trade book</li>
 * </ul>
 *
 * <p>Broker rejections of an order never become HTTP errors: they come back as
 * {@code success=false} with the broker's error text.
 */
@RestController
@RequestMapping("/api")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final BrokerSessionManager brokerSessionManager;

    public OrderController(BrokerSessionManager brokerSessionManager) {
        this.brokerSessionManager = brokerSessionManager;
    }

    @PostMapping("/order")
    public ResponseEntity<LegResult> placeOrder(@RequestBody OrderLeg leg) {
        BrokerSession session = brokerSessionManager.requireSession();
        log.info("Single order: {} {} {} {}{}", leg.getAction(), leg.getQuantity(), leg.getStockCode(),
                leg.getStrikePrice(), leg.getRight());
        return ResponseEntity.ok(session.placeOrder(leg));
    }

    @PostMapping("/strategy/execute")
    public ResponseEntity<StrategyExecutionResponse> executeStrategy(
            @Valid @RequestBody StrategyExecuteRequest request) {
        BrokerSession session = brokerSessionManager.requireSession();
        List<LegResult> results = session.executeStrategy(request.getLegs());
        return ResponseEntity.ok(StrategyExecutionResponse.of(results));
    }

    @PostMapping("/squareoff")
    public ResponseEntity<LegResult> squareOff(@RequestBody OrderLeg leg) {
        BrokerSession session = brokerSessionManager.requireSession();
        return ResponseEntity.ok(session.squareOff(leg));
    }

    @PostMapping("/order/cancel")
    public ResponseEntity<OrderActionResult> cancelOrder(@Valid @RequestBody CancelOrderRequest request) {
        BrokerSession session = brokerSessionManager.requireSession();
        log.info("Cancelling order {}", request.getOrderId());
        return ResponseEntity.ok(session.cancelOrder(request.getOrderId(), request.getExchangeCode()));
    }

    @PatchMapping("/order/modify")
    public ResponseEntity<OrderActionResult> modifyOrder(@Valid @RequestBody ModifyOrderRequest request) {
        BrokerSession session = brokerSessionManager.requireSession();
        log.info("Modifying order {}: qty={}, price={}", request.getOrderId(), request.getQuantity(),
                request.getPrice());
        return ResponseEntity.ok(session.modifyOrder(request.toModification()));
    }

    @GetMapping("/orders")
    public ResponseEntity<List<Map<String, Object>>> orders() {
        return ResponseEntity.ok(brokerSessionManager.requireSession().orderBook());
    }

    @GetMapping("/trades")
    public ResponseEntity<List<Map<String, Object>>> trades() {
        return ResponseEntity.ok(brokerSessionManager.requireSession().tradeBook());
    }
}
