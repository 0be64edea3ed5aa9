package com.optionsterminal.simulator;

import com.optionsterminal.broker.BrokerClient;
import com.optionsterminal.broker.BrokerResponse;
import com.optionsterminal.broker.TickListener;
import com.optionsterminal.domain.enums.OptionRight;
import com.optionsterminal.domain.model.FeedSubscription;
import com.optionsterminal.domain.model.HistoricalQuery;
import com.optionsterminal.domain.model.OptionChainQuery;
import com.optionsterminal.domain.model.OrderModification;
import com.optionsterminal.domain.model.QuoteQuery;
import com.optionsterminal.exception.BrokerException;
import com.optionsterminal.oms.OrderLeg;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory broker for paper trading and tests. REST calls answer from
 * {@link SimulatedMarket} and {@link SimulatedOrderBook}; the push feed emits one tick per
 * subscribed contract at a fixed rate, each carrying the underlying level in
 * {@code index_close_price} the way the live feed does.
 */
public class SimulatedBrokerClient implements BrokerClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedBrokerClient.class);

    private static final DateTimeFormatter FEED_TIME = DateTimeFormatter.ofPattern("dd-MMM-yyyy HH:mm:ss", Locale.ENGLISH);
    private static final DateTimeFormatter CANDLE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int HISTORICAL_BARS = 20;

    private final String sessionKey;
    private final SimulatedMarket market;
    private final SimulatedOrderBook orderBook;
    private final Clock clock;
    private final long tickIntervalMs;

    private final Set<FeedSubscription> subscriptions = new LinkedHashSet<>();
    private volatile TickListener tickListener;
    private ScheduledExecutorService feedExecutor;

    public SimulatedBrokerClient(String sessionKey, SimulatedMarket market, Clock clock, long tickIntervalMs) {
        this.sessionKey = sessionKey;
        this.market = market;
        this.orderBook = new SimulatedOrderBook(clock);
        this.clock = clock;
        this.tickIntervalMs = tickIntervalMs;
    }

    @Override
    public String getSessionKey() {
        return sessionKey;
    }

    // ---- Account ----

    @Override
    public BrokerResponse getCustomerDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("name", "Paper Trader");
        details.put("email", "paper@options-terminal.local");
        details.put("idirect_userid", "PAPER");
        return BrokerResponse.ok(details);
    }

    @Override
    public BrokerResponse getFunds() {
        Map<String, Object> funds = new LinkedHashMap<>();
        funds.put("total_bank_balance", 1_000_000.0);
        funds.put("allocated_fno", 500_000.0);
        funds.put("block_by_trade_fno", 0.0);
        funds.put("unallocated_balance", "500000.0");
        return BrokerResponse.ok(funds);
    }

    @Override
    public BrokerResponse getPortfolioPositions() {
        return BrokerResponse.ok(orderBook.netPositions());
    }

    @Override
    public BrokerResponse getPortfolioHoldings() {
        return BrokerResponse.ok(List.of());
    }

    // ---- Market data ----

    @Override
    public BrokerResponse getOptionChainQuotes(OptionChainQuery query) {
        String symbol = query.getStockCode();
        List<Integer> strikes = new ArrayList<>();
        if (query.getStrikePrice() != null && !query.getStrikePrice().isBlank()) {
            strikes.add((int) Double.parseDouble(query.getStrikePrice()));
        } else {
            int atm = market.atmStrike(symbol);
            for (int i = -market.getStrikesEachSide(); i <= market.getStrikesEachSide(); i++) {
                strikes.add(atm + i * market.getStrikeStep());
            }
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (int strike : strikes) {
            Map<String, Object> row = new LinkedHashMap<>();
            double premium = market.premium(symbol, strike, query.getRight());
            row.put("stock_code", symbol);
            row.put("exchange_code", query.getExchangeCode());
            row.put("expiry_date", query.getExpiryDate());
            row.put("right", query.getRight().brokerName());
            row.put("strike_price", String.valueOf(strike));
            row.put("ltp", premium);
            row.put("best_bid_price", SimulatedMarket.round2(premium - 0.05));
            row.put("best_offer_price", SimulatedMarket.round2(premium + 0.05));
            row.put("open_interest", 100_000 + Math.abs(strike % 7) * 25_000);
            row.put("total_quantity_traded", 50_000);
            row.put("implied_volatility", market.impliedVolatility(symbol, strike));
            row.put("spot_price", String.valueOf(SimulatedMarket.round2(market.spot(symbol))));
            rows.add(row);
        }
        return BrokerResponse.ok(rows);
    }

    @Override
    public BrokerResponse getQuotes(QuoteQuery query) {
        String symbol = query.getStockCode();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("stock_code", symbol);
        row.put("exchange_code", query.getExchangeCode());
        if (query.getRight() == null || query.getRight().isBlank()) {
            double spot = SimulatedMarket.round2(market.spot(symbol));
            row.put("ltp", spot);
            row.put("close", spot);
            row.put("ltp_percent_change", market.changePercent(symbol));
        } else {
            OptionRight right = OptionRight.parse(query.getRight());
            int strike = (int) Double.parseDouble(query.getStrikePrice());
            double premium = market.premium(symbol, strike, right);
            row.put("expiry_date", query.getExpiryDate());
            row.put("right", right.brokerName());
            row.put("strike_price", String.valueOf(strike));
            row.put("ltp", premium);
            row.put("best_bid_price", SimulatedMarket.round2(premium - 0.05));
            row.put("best_offer_price", SimulatedMarket.round2(premium + 0.05));
        }
        return BrokerResponse.ok(List.of(row));
    }

    @Override
    public BrokerResponse getHistoricalData(HistoricalQuery query) {
        Duration step = intervalOf(query.getInterval());
        double level = query.isOptionContract()
                ? market.premium(query.getStockCode(), (int) Double.parseDouble(query.getStrikePrice()),
                        OptionRight.parse(query.getRight()))
                : market.spot(query.getStockCode());
        LocalDateTime end = LocalDateTime.now(clock);
        List<Map<String, Object>> candles = new ArrayList<>();
        for (int i = HISTORICAL_BARS - 1; i >= 0; i--) {
            double drift = 1 + (i % 5 - 2) * 0.001;
            double close = SimulatedMarket.round2(level * drift);
            Map<String, Object> candle = new LinkedHashMap<>();
            candle.put("datetime", end.minus(step.multipliedBy(i)).format(CANDLE_TIME));
            candle.put("stock_code", query.getStockCode());
            candle.put("open", SimulatedMarket.round2(close * 0.999));
            candle.put("high", SimulatedMarket.round2(close * 1.002));
            candle.put("low", SimulatedMarket.round2(close * 0.998));
            candle.put("close", close);
            candle.put("volume", 10_000 + i * 100);
            candles.add(candle);
        }
        return BrokerResponse.ok(candles);
    }

    // ---- Orders ----

    @Override
    public BrokerResponse placeOrder(OrderLeg leg) {
        int strike = leg.getStrikePrice().intValue();
        String orderId = orderBook.place(leg, market.premium(leg.getStockCode(), strike, leg.getRight()));
        log.debug("Paper order {} {} {} {}{}", orderId, leg.getAction(), leg.getQuantity(), strike,
                leg.getRight().code());
        Map<String, Object> success = new LinkedHashMap<>();
        success.put("order_id", orderId);
        success.put("message", "Successfully Placed the order");
        return BrokerResponse.ok(success);
    }

    @Override
    public BrokerResponse cancelOrder(String exchangeCode, String orderId) {
        if (!orderBook.cancel(orderId)) {
            return BrokerResponse.error(500, "Order " + orderId + " is not open");
        }
        return BrokerResponse.ok(Map.of("order_id", orderId, "message", "Successfully cancelled the order"));
    }

    @Override
    public BrokerResponse modifyOrder(OrderModification modification) {
        if (!orderBook.modify(modification)) {
            return BrokerResponse.error(500, "Order " + modification.getOrderId() + " is not open");
        }
        return BrokerResponse.ok(
                Map.of("order_id", modification.getOrderId(), "message", "Successfully modified the order"));
    }

    @Override
    public BrokerResponse getOrderList(String exchangeCode, LocalDate fromDate, LocalDate toDate) {
        return BrokerResponse.ok(orderBook.orders(exchangeCode, fromDate, toDate));
    }

    @Override
    public BrokerResponse getTradeList(String exchangeCode, LocalDate fromDate, LocalDate toDate) {
        return BrokerResponse.ok(orderBook.trades(exchangeCode, fromDate, toDate));
    }

    // ---- Push feed ----

    @Override
    public void setTickListener(TickListener listener) {
        this.tickListener = listener;
    }

    @Override
    public synchronized void connectFeed() {
        if (feedExecutor != null) {
            return;
        }
        feedExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "simulated-feed");
            thread.setDaemon(true);
            return thread;
        });
        if (tickIntervalMs > 0) {
            feedExecutor.scheduleAtFixedRate(this::pushTicksSafely, tickIntervalMs, tickIntervalMs, TimeUnit.MILLISECONDS);
        }
        log.info("Simulated push feed connected, tick interval {}ms", tickIntervalMs);
    }

    @Override
    public synchronized void disconnectFeed() {
        if (feedExecutor != null) {
            feedExecutor.shutdownNow();
            feedExecutor = null;
            log.info("Simulated push feed disconnected");
        }
        subscriptions.clear();
    }

    @Override
    public synchronized void subscribeFeed(FeedSubscription subscription) {
        requireFeed();
        subscriptions.add(subscription);
    }

    @Override
    public synchronized void unsubscribeFeed(FeedSubscription subscription) {
        requireFeed();
        subscriptions.remove(subscription);
    }

    public synchronized boolean isFeedConnected() {
        return feedExecutor != null;
    }

    public synchronized int feedSubscriptionCount() {
        return subscriptions.size();
    }

    /**
     * Emits one tick per subscribed contract to the registered listener.
     *
     * @return number of ticks delivered
     */
    public int pushTicks() {
        List<FeedSubscription> active;
        synchronized (this) {
            active = List.copyOf(subscriptions);
        }
        TickListener listener = tickListener;
        if (listener == null || active.isEmpty()) {
            return 0;
        }

        Set<String> walked = new LinkedHashSet<>();
        List<Map<String, Object>> batch = new ArrayList<>();
        String feedTime = LocalDateTime.now(clock).format(FEED_TIME);
        for (FeedSubscription subscription : active) {
            String symbol = subscription.getStockCode();
            if (walked.add(symbol)) {
                market.walk(symbol);
            }
            batch.add(feedTick(subscription, feedTime));
        }
        listener.onTicks(batch);
        return batch.size();
    }

    private Map<String, Object> feedTick(FeedSubscription subscription, String feedTime) {
        String symbol = subscription.getStockCode();
        int strike = subscription.getStrikePrice();
        double premium = market.premium(symbol, strike, subscription.getRight());
        Map<String, Object> tick = new LinkedHashMap<>();
        tick.put("stock_code", symbol);
        tick.put("exchange_code", subscription.getExchangeCode());
        tick.put("expiry_date", subscription.getExpiryDate());
        tick.put("strike_price", String.valueOf(strike));
        tick.put("right", subscription.getRight().brokerName());
        tick.put("last_traded_price", premium);
        tick.put("best_bid_price", SimulatedMarket.round2(premium - 0.05));
        tick.put("best_offer_price", SimulatedMarket.round2(premium + 0.05));
        tick.put("open_interest", 100_000 + Math.abs(strike % 7) * 25_000);
        tick.put("total_quantity_traded", 50_000);
        tick.put("change_percent", market.changePercent(symbol));
        tick.put("exchange_feed_time", feedTime);
        tick.put("index_close_price", SimulatedMarket.round2(market.spot(symbol)));
        return tick;
    }

    private void pushTicksSafely() {
        try {
            pushTicks();
        } catch (RuntimeException e) {
            // A throwing task would cancel the fixed-rate schedule
            log.warn("Simulated tick push failed: {}", e.getMessage());
        }
    }

    private void requireFeed() {
        if (feedExecutor == null) {
            throw new BrokerException("Push feed is not connected");
        }
    }

    static Duration intervalOf(String interval) {
        if (interval == null) {
            return Duration.ofDays(1);
        }
        return switch (interval.toLowerCase(Locale.ROOT)) {
            case "1second" -> Duration.ofSeconds(1);
            case "1minute" -> Duration.ofMinutes(1);
            case "5minute" -> Duration.ofMinutes(5);
            case "30minute" -> Duration.ofMinutes(30);
            default -> Duration.ofDays(1);
        };
    }
}
