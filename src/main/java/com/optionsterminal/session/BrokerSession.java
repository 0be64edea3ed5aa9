package com.optionsterminal.session;

import com.optionsterminal.broker.BrokerClient;
import com.optionsterminal.broker.BrokerCredentials;
import com.optionsterminal.broker.BrokerResponse;
import com.optionsterminal.broker.PacingQueue;
import com.optionsterminal.broker.RateStatus;
import com.optionsterminal.config.GatewayProperties;
import com.optionsterminal.domain.enums.OptionRight;
import com.optionsterminal.domain.enums.WorkKind;
import com.optionsterminal.domain.model.FeedSubscription;
import com.optionsterminal.domain.model.HistoricalQuery;
import com.optionsterminal.domain.model.OptionChainQuery;
import com.optionsterminal.domain.model.OrderModification;
import com.optionsterminal.domain.model.PortfolioSnapshot;
import com.optionsterminal.domain.model.QuoteQuery;
import com.optionsterminal.domain.model.SpotQuote;
import com.optionsterminal.domain.model.TickKey;
import com.optionsterminal.domain.model.TickUpdate;
import com.optionsterminal.exception.BrokerException;
import com.optionsterminal.exception.InvalidOrderLegException;
import com.optionsterminal.exception.NotConnectedException;
import com.optionsterminal.marketdata.FeedTickHandler;
import com.optionsterminal.marketdata.FieldAliasTable;
import com.optionsterminal.marketdata.OptionChainSeeder;
import com.optionsterminal.marketdata.TickCache;
import com.optionsterminal.marketdata.TickField;
import com.optionsterminal.oms.LegResult;
import com.optionsterminal.oms.OrderActionResult;
import com.optionsterminal.oms.OrderLeg;
import com.optionsterminal.oms.StrategyOrderOrchestrator;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One authenticated broker session and everything scoped to it: the pacing lane all REST
 * calls go through, the tick cache, the push-feed subscription set and the feed callback.
 *
 * <p>Created by {@link BrokerSessionManager} on connect and closed on disconnect. Every
 * operation on a closed session fails with {@link NotConnectedException}. Order-affecting
 * operations never throw broker failures at the caller; they report them in their result.
 */
public class BrokerSession {

    private static final Logger log = LoggerFactory.getLogger(BrokerSession.class);

    static final String ORDER_BOOK_EXCHANGE = "NFO";

    private static final List<OptionRight> BOTH_RIGHTS = List.of(OptionRight.CALL, OptionRight.PUT);

    private final String sessionId;
    private final BrokerClient client;
    private final PacingQueue pacingQueue;
    private final TickCache tickCache;
    private final FeedTickHandler feedTickHandler;
    private final OptionChainSeeder optionChainSeeder;
    private final StrategyOrderOrchestrator orchestrator;
    private final GatewayProperties properties;
    private final Clock clock;
    private final double connectedAt;

    /**
     * Active subscriptions mapped to the exchange they were subscribed on. Mutated only under
     * {@link #feedLock}; readable without it.
     */
    private final Map<TickKey, String> subscriptions = new ConcurrentHashMap<>();

    private final Object feedLock = new Object();
    private final AtomicBoolean feedLive = new AtomicBoolean(false);
    private final AtomicBoolean open = new AtomicBoolean(true);

    public BrokerSession(
            String sessionId,
            BrokerClient client,
            PacingQueue pacingQueue,
            TickCache tickCache,
            StrategyOrderOrchestrator orchestrator,
            GatewayProperties properties,
            Clock clock) {
        this.sessionId = sessionId;
        this.client = client;
        this.pacingQueue = pacingQueue;
        this.tickCache = tickCache;
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.clock = clock;
        this.feedTickHandler = new FeedTickHandler(tickCache, properties.getFeed().getSpotThreshold());
        this.optionChainSeeder = new OptionChainSeeder(tickCache);
        this.connectedAt = clock.millis() / 1000.0;
    }

    /** Starts the pacing lane. Called once by the manager before the session is published. */
    void start() {
        pacingQueue.start();
    }

    // ---- Account ----

    /** Best-effort customer profile; empty when the broker has none or the call fails. */
    public Map<String, Object> customerDetails() {
        requireOpen();
        try {
            BrokerResponse response = call(client::getCustomerDetails, WorkKind.READ, "customerDetails");
            return response.isOk() ? response.successObject() : Map.of();
        } catch (RuntimeException e) {
            log.warn("Customer details unavailable for session {}: {}", sessionId, e.getMessage());
            return Map.of();
        }
    }

    public Map<String, Object> funds() {
        requireOpen();
        return requireOk(call(client::getFunds, WorkKind.READ, "funds"), "funds").successObject();
    }

    public PortfolioSnapshot positions() {
        requireOpen();
        BrokerResponse positions = call(client::getPortfolioPositions, WorkKind.READ, "positions");
        BrokerResponse holdings = call(client::getPortfolioHoldings, WorkKind.READ, "holdings");
        return PortfolioSnapshot.builder()
                .positions(requireOk(positions, "positions").successRows())
                .holdings(requireOk(holdings, "holdings").successRows())
                .build();
    }

    // ---- Market data ----

    /** Queries the option chain and seeds the tick cache with the returned rows. */
    public List<Map<String, Object>> fetchOptionChain(OptionChainQuery query) {
        requireOpen();
        log.info("Option chain {} {} {}", query.getStockCode(), query.getExpiryDate(), query.getRight().brokerName());
        BrokerResponse response = call(
                () -> client.getOptionChainQuotes(query), WorkKind.READ, "optionChain " + query.getStockCode());
        List<Map<String, Object>> rows = requireOk(response, "option chain").successRows();
        optionChainSeeder.seed(query.getStockCode(), query.getRight(), rows);
        return rows;
    }

    public List<Map<String, Object>> quote(QuoteQuery query) {
        requireOpen();
        BrokerResponse response = call(() -> client.getQuotes(query), WorkKind.READ, "quote " + query.getStockCode());
        return requireOk(response, "quote").successRows();
    }

    /**
     * Spot level of {@code stockCode}: the cached value when the feed has supplied one,
     * otherwise a REST quote on the cash segment, which is then cached.
     *
     * @throws BrokerException if neither source yields a plausible level
     */
    public SpotQuote spotPrice(String stockCode, String exchangeCode) {
        requireOpen();
        double threshold = properties.getFeed().getSpotThreshold();
        Optional<Double> cached = tickCache.spotPrice(stockCode).filter(spot -> spot > threshold);
        if (cached.isPresent()) {
            return spotQuote(stockCode, exchangeCode, cached.get(), SpotQuote.SOURCE_FEED);
        }

        QuoteQuery query = QuoteQuery.builder()
                .stockCode(stockCode)
                .exchangeCode(exchangeCode)
                .expiryDate("")
                .right("")
                .strikePrice("")
                .build();
        BrokerResponse response = call(() -> client.getQuotes(query), WorkKind.READ, "spot " + stockCode);
        for (Map<String, Object> row : response.successRows()) {
            List<Double> candidates = FieldAliasTable.QUOTE_ROW.positiveNumbers(row, TickField.LTP);
            if (!candidates.isEmpty() && candidates.get(0) > threshold) {
                double spot = candidates.get(0);
                tickCache.update(
                        TickKey.spot(stockCode),
                        TickUpdate.builder().ltp(spot).source("rest").build());
                return spotQuote(stockCode, exchangeCode, spot, SpotQuote.SOURCE_REST);
            }
        }
        throw new BrokerException("No spot price returned for " + stockCode + "/" + exchangeCode
                + (response.isOk() ? "" : ": " + response.errorText()));
    }

    public List<Map<String, Object>> historical(HistoricalQuery query) {
        requireOpen();
        BrokerResponse response =
                call(() -> client.getHistoricalData(query), WorkKind.READ, "historical " + query.getStockCode());
        return requireOk(response, "historical data").successRows();
    }

    // ---- Orders ----

    /**
     * Submits one leg through the pacing lane. Used directly by the orchestrator.
     *
     * @throws InvalidOrderLegException if a required field is missing
     */
    public BrokerResponse submitLeg(OrderLeg leg) {
        requireOpen();
        if (leg.isUnreadable()) {
            throw new InvalidOrderLegException(leg.getUnreadableReason());
        }
        List<String> missing = leg.missingRequiredFields();
        if (!missing.isEmpty()) {
            throw new InvalidOrderLegException(missing);
        }
        OrderLeg prepared = leg.withDefaults(properties.getOrders().getDefaultRemark());
        String description = "placeOrder " + prepared.getAction().brokerValue() + " " + prepared.getQuantity() + " "
                + prepared.getStockCode() + " " + prepared.getStrikePrice().toPlainString()
                + prepared.getRight().code();
        return call(() -> client.placeOrder(prepared), WorkKind.ORDER, description);
    }

    public LegResult placeOrder(OrderLeg leg) {
        return executeStrategy(List.of(leg)).get(0);
    }

    public List<LegResult> executeStrategy(List<OrderLeg> legs) {
        requireOpen();
        return orchestrator.execute(legs, this::submitLeg);
    }

    /** Places the closing counterpart of {@code leg}: opposite action, square-off remark. */
    public LegResult squareOff(OrderLeg leg) {
        OrderLeg exit = leg.squareOff(properties.getOrders().getSquareOffRemark());
        log.info("Square-off {} {} -> {}", leg.getStockCode(), leg.getAction(), exit.getAction());
        return placeOrder(exit);
    }

    public OrderActionResult cancelOrder(String orderId, String exchangeCode) {
        requireOpen();
        try {
            BrokerResponse response =
                    call(() -> client.cancelOrder(exchangeCode, orderId), WorkKind.ORDER, "cancel " + orderId);
            return OrderActionResult.fromResponse(response);
        } catch (RuntimeException e) {
            log.warn("Cancel of order {} failed: {}", orderId, e.getMessage());
            return OrderActionResult.failed(e.getMessage());
        }
    }

    public OrderActionResult modifyOrder(OrderModification modification) {
        requireOpen();
        try {
            BrokerResponse response = call(
                    () -> client.modifyOrder(modification), WorkKind.ORDER, "modify " + modification.getOrderId());
            return OrderActionResult.fromResponse(response);
        } catch (RuntimeException e) {
            log.warn("Modify of order {} failed: {}", modification.getOrderId(), e.getMessage());
            return OrderActionResult.failed(e.getMessage());
        }
    }

    /** Today's orders on the derivatives segment. */
    public List<Map<String, Object>> orderBook() {
        requireOpen();
        LocalDate today = LocalDate.now(clock);
        BrokerResponse response =
                call(() -> client.getOrderList(ORDER_BOOK_EXCHANGE, today, today), WorkKind.READ, "orderBook");
        return requireOk(response, "order book").successRows();
    }

    /** Today's trades on the derivatives segment. */
    public List<Map<String, Object>> tradeBook() {
        requireOpen();
        LocalDate today = LocalDate.now(clock);
        BrokerResponse response =
                call(() -> client.getTradeList(ORDER_BOOK_EXCHANGE, today, today), WorkKind.READ, "tradeBook");
        return requireOk(response, "trade book").successRows();
    }

    // ---- Push feed ----

    /** Connects the push feed and registers the tick callback. No-op when already live. */
    public void startFeed() {
        requireOpen();
        synchronized (feedLock) {
            if (feedLive.get()) {
                return;
            }
            client.setTickListener(feedTickHandler);
            try {
                client.connectFeed();
            } catch (RuntimeException e) {
                log.error("Push feed connect failed for session {}: {}", sessionId, e.getMessage());
                throw new BrokerException("Push feed connect failed: " + e.getMessage(), e);
            }
            feedLive.set(true);
            log.info("Push feed live for session {}", sessionId);
        }
    }

    /**
     * Subscribes every (strike, right) tuple not already in the subscription set. Starts the
     * feed first if needed. A failing subscribe call is recorded and the rest continue.
     */
    public SubscriptionResult subscribeOptionChain(
            String stockCode, String exchangeCode, String expiryDate, List<Integer> strikes, List<OptionRight> rights) {
        requireOpen();
        if (!feedLive.get()) {
            startFeed();
        }
        List<OptionRight> effectiveRights = rights == null || rights.isEmpty() ? BOTH_RIGHTS : rights;
        long spacingMs = properties.getFeed().getSubscribeSpacingMs();
        int issued = 0;
        List<String> errors = new ArrayList<>();

        for (Integer strike : strikes) {
            for (OptionRight right : effectiveRights) {
                TickKey key = TickKey.option(stockCode, strike, right, expiryDate);
                // Lock per tuple only; the spacing pause below runs without it
                synchronized (feedLock) {
                    if (!open.get()) {
                        errors.add("Session closed after " + issued + " calls");
                        return result(issued, errors);
                    }
                    if (subscriptions.containsKey(key)) {
                        continue;
                    }
                    try {
                        client.subscribeFeed(subscription(key, exchangeCode));
                        subscriptions.put(key, exchangeCode);
                        issued++;
                    } catch (RuntimeException e) {
                        log.warn("Subscribe {} failed: {}", key.toWireKey(), e.getMessage());
                        errors.add(key.toWireKey() + ": " + e.getMessage());
                        continue;
                    }
                }
                if (!pause(spacingMs)) {
                    errors.add("Subscription interrupted after " + issued + " calls");
                    return result(issued, errors);
                }
            }
        }
        log.info("Subscribed {} new contracts for {} {} (total {})", issued, stockCode, expiryDate,
                subscriptions.size());
        return result(issued, errors);
    }

    /**
     * Unsubscribes every active tuple and empties the subscription set. Individual
     * unsubscribe failures are logged and skipped.
     *
     * @return number of tuples that were active
     */
    public int unsubscribeAll() {
        synchronized (feedLock) {
            int active = subscriptions.size();
            if (feedLive.get()) {
                subscriptions.forEach((key, exchange) -> {
                    try {
                        client.unsubscribeFeed(subscription(key, exchange));
                    } catch (RuntimeException e) {
                        log.warn("Unsubscribe {} failed: {}", key.toWireKey(), e.getMessage());
                    }
                });
            }
            subscriptions.clear();
            if (active > 0) {
                log.info("Unsubscribed {} contracts for session {}", active, sessionId);
            }
            return active;
        }
    }

    /**
     * Tears the session down: drops subscriptions, disconnects the feed, stops the pacing
     * lane (pending callers fail with {@link NotConnectedException}) and clears the cache.
     * Idempotent.
     */
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        unsubscribeAll();
        synchronized (feedLock) {
            if (feedLive.getAndSet(false)) {
                try {
                    client.disconnectFeed();
                } catch (RuntimeException e) {
                    log.warn("Push feed disconnect failed for session {}: {}", sessionId, e.getMessage());
                }
            }
        }
        pacingQueue.shutdown();
        tickCache.clear();
        log.info("Session {} closed", sessionId);
    }

    // ---- State ----

    public String getSessionId() {
        return sessionId;
    }

    public String getSessionKey() {
        return client.getSessionKey();
    }

    public boolean isOpen() {
        return open.get();
    }

    public boolean isFeedLive() {
        return feedLive.get();
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    public Set<TickKey> subscriptions() {
        return Set.copyOf(subscriptions.keySet());
    }

    public TickCache getTickCache() {
        return tickCache;
    }

    public PacingQueue getPacingQueue() {
        return pacingQueue;
    }

    public FeedTickHandler getFeedTickHandler() {
        return feedTickHandler;
    }

    public RateStatus rateStatus() {
        return pacingQueue.rateStatus();
    }

    public double getConnectedAt() {
        return connectedAt;
    }

    /** Masked session key for logs. */
    String maskedSessionKey() {
        return BrokerCredentials.mask(client.getSessionKey());
    }

    private <T> T call(Callable<T> work, WorkKind kind, String description) {
        return pacingQueue.enqueue(work, kind, description);
    }

    private void requireOpen() {
        if (!open.get()) {
            throw new NotConnectedException("Session " + sessionId + " is closed");
        }
    }

    private static BrokerResponse requireOk(BrokerResponse response, String operation) {
        if (response == null) {
            throw new BrokerException("Broker returned no response for " + operation);
        }
        if (!response.isOk()) {
            throw new BrokerException("Broker rejected " + operation + ": " + response.errorText());
        }
        return response;
    }

    private static FeedSubscription subscription(TickKey key, String exchangeCode) {
        return FeedSubscription.builder()
                .stockCode(key.getSymbol())
                .exchangeCode(exchangeCode)
                .expiryDate(key.getExpiry())
                .strikePrice(key.getStrike())
                .right(key.getRight())
                .build();
    }

    private SubscriptionResult result(int issued, List<String> errors) {
        return SubscriptionResult.builder()
                .subscribed(issued)
                .totalSubscriptions(subscriptions.size())
                .errors(List.copyOf(errors))
                .build();
    }

    private static boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static SpotQuote spotQuote(String stockCode, String exchangeCode, double spot, String source) {
        return SpotQuote.builder()
                .stockCode(stockCode.toUpperCase())
                .exchangeCode(exchangeCode)
                .spot(spot)
                .source(source)
                .build();
    }
}
