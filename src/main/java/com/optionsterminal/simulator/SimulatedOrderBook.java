package com.optionsterminal.simulator;

import com.optionsterminal.domain.model.OrderModification;
import com.optionsterminal.oms.OrderLeg;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Paper order book. Market orders execute immediately at the simulated premium; limit
 * orders rest as "Ordered" until cancelled or modified. Records use the broker's field
 * names so the gateway passes them through unchanged.
 */
public class SimulatedOrderBook {

    static final String STATUS_ORDERED = "Ordered";
    static final String STATUS_EXECUTED = "Executed";
    static final String STATUS_CANCELLED = "Cancelled";

    private static final DateTimeFormatter ORDER_ID_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter ORDER_TIME = DateTimeFormatter.ofPattern("dd-MMM-yyyy HH:mm:ss", Locale.ENGLISH);

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    private final Map<String, Map<String, Object>> orders = new LinkedHashMap<>();
    private final Map<String, LocalDate> orderDates = new LinkedHashMap<>();
    private final List<Map<String, Object>> trades = new ArrayList<>();

    public SimulatedOrderBook(Clock clock) {
        this.clock = clock;
    }

    /** @return the new order id */
    public synchronized String place(OrderLeg leg, double marketPremium) {
        LocalDateTime now = LocalDateTime.now(clock);
        String orderId = now.format(ORDER_ID_DATE) + "N" + String.format("%09d", sequence.incrementAndGet());
        boolean market = leg.getOrderType() == null || "market".equalsIgnoreCase(leg.getOrderType());

        Map<String, Object> order = new LinkedHashMap<>();
        order.put("order_id", orderId);
        order.put("exchange_code", leg.getExchangeCode());
        order.put("stock_code", leg.getStockCode());
        order.put("product_type", leg.getProduct());
        order.put("action", leg.getAction().brokerValue());
        order.put("order_type", market ? "market" : leg.getOrderType());
        order.put("quantity", String.valueOf(leg.getQuantity()));
        order.put("price", market ? String.valueOf(marketPremium) : leg.getPrice().toPlainString());
        order.put("stoploss", leg.getStoploss() == null ? "0" : leg.getStoploss().toPlainString());
        order.put("expiry_date", leg.getExpiryDate());
        order.put("strike_price", leg.getStrikePrice().toPlainString());
        order.put("right", leg.getRight().brokerName());
        order.put("user_remark", leg.getUserRemark());
        order.put("order_datetime", now.format(ORDER_TIME));
        order.put("status", market ? STATUS_EXECUTED : STATUS_ORDERED);
        orders.put(orderId, order);
        orderDates.put(orderId, now.toLocalDate());

        if (market) {
            recordTrade(order, marketPremium, now);
        }
        return orderId;
    }

    public synchronized boolean cancel(String orderId) {
        Map<String, Object> order = orders.get(orderId);
        if (order == null || !STATUS_ORDERED.equals(order.get("status"))) {
            return false;
        }
        order.put("status", STATUS_CANCELLED);
        return true;
    }

    public synchronized boolean modify(OrderModification modification) {
        Map<String, Object> order = orders.get(modification.getOrderId());
        if (order == null || !STATUS_ORDERED.equals(order.get("status"))) {
            return false;
        }
        putIfPresent(order, "quantity", modification.getQuantity());
        putIfPresent(order, "price", modification.getPrice());
        putIfPresent(order, "stoploss", modification.getStoploss());
        putIfPresent(order, "validity", modification.getValidity());
        return true;
    }

    public synchronized Optional<Map<String, Object>> find(String orderId) {
        return Optional.ofNullable(orders.get(orderId)).map(LinkedHashMap::new);
    }

    public synchronized List<Map<String, Object>> orders(String exchangeCode, LocalDate from, LocalDate to) {
        List<Map<String, Object>> matching = new ArrayList<>();
        orders.forEach((orderId, order) -> {
            LocalDate date = orderDates.get(orderId);
            if (exchangeCode.equalsIgnoreCase(String.valueOf(order.get("exchange_code")))
                    && !date.isBefore(from)
                    && !date.isAfter(to)) {
                matching.add(new LinkedHashMap<>(order));
            }
        });
        return matching;
    }

    public synchronized List<Map<String, Object>> trades(String exchangeCode, LocalDate from, LocalDate to) {
        List<Map<String, Object>> matching = new ArrayList<>();
        for (Map<String, Object> trade : trades) {
            LocalDate date = orderDates.get(String.valueOf(trade.get("order_id")));
            if (exchangeCode.equalsIgnoreCase(String.valueOf(trade.get("exchange_code")))
                    && !date.isBefore(from)
                    && !date.isAfter(to)) {
                matching.add(new LinkedHashMap<>(trade));
            }
        }
        return matching;
    }

    /** Net executed quantity per contract, one row per contract with a non-zero position. */
    public synchronized List<Map<String, Object>> netPositions() {
        Map<String, Map<String, Object>> byContract = new LinkedHashMap<>();
        for (Map<String, Object> trade : trades) {
            String contract = trade.get("stock_code") + ":" + trade.get("strike_price") + ":" + trade.get("right") + ":"
                    + trade.get("expiry_date");
            Map<String, Object> position = byContract.computeIfAbsent(contract, c -> {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("stock_code", trade.get("stock_code"));
                row.put("exchange_code", trade.get("exchange_code"));
                row.put("expiry_date", trade.get("expiry_date"));
                row.put("strike_price", trade.get("strike_price"));
                row.put("right", trade.get("right"));
                row.put("quantity", 0L);
                return row;
            });
            long quantity = Long.parseLong(String.valueOf(trade.get("quantity")));
            long signed = "buy".equals(trade.get("action")) ? quantity : -quantity;
            position.put("quantity", (Long) position.get("quantity") + signed);
        }
        return byContract.values().stream()
                .filter(row -> (Long) row.get("quantity") != 0L)
                .map(row -> (Map<String, Object>) new LinkedHashMap<>(row))
                .toList();
    }

    private void recordTrade(Map<String, Object> order, double price, LocalDateTime at) {
        Map<String, Object> trade = new LinkedHashMap<>();
        trade.put("order_id", order.get("order_id"));
        trade.put("exchange_code", order.get("exchange_code"));
        trade.put("stock_code", order.get("stock_code"));
        trade.put("action", order.get("action"));
        trade.put("quantity", order.get("quantity"));
        trade.put("average_cost", String.valueOf(price));
        trade.put("expiry_date", order.get("expiry_date"));
        trade.put("strike_price", order.get("strike_price"));
        trade.put("right", order.get("right"));
        trade.put("trade_date", at.format(ORDER_TIME));
        trades.add(trade);
    }

    private static void putIfPresent(Map<String, Object> order, String field, String value) {
        if (value != null && !value.isBlank()) {
            order.put(field, value);
        }
    }
}
