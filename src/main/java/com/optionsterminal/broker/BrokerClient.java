package com.optionsterminal.broker;

import com.optionsterminal.domain.model.FeedSubscription;
import com.optionsterminal.domain.model.HistoricalQuery;
import com.optionsterminal.domain.model.OptionChainQuery;
import com.optionsterminal.domain.model.OrderModification;
import com.optionsterminal.domain.model.QuoteQuery;
import com.optionsterminal.oms.OrderLeg;
import java.time.LocalDate;

/**
 * The broker's trading API as seen by the gateway: a synchronous REST command surface
 * plus a push feed.
 *
 * <p>Every REST method is a single round-trip that counts against the broker's rate
 * limit. Callers MUST route them through the session's {@link PacingQueue}; this
 * interface does no pacing of its own. Push-feed methods are not rate limited.
 *
 * <p>REST failures are reported either in the returned {@link BrokerResponse} (non-200
 * status with error text) or by throwing
 * {@link com.optionsterminal.exception.BrokerException}.
 */
public interface BrokerClient {

    /** Broker-issued key for the established session. */
    String getSessionKey();

    // ---- Account ----

    BrokerResponse getCustomerDetails();

    BrokerResponse getFunds();

    BrokerResponse getPortfolioPositions();

    BrokerResponse getPortfolioHoldings();

    // ---- Market data (REST) ----

    BrokerResponse getOptionChainQuotes(OptionChainQuery query);

    BrokerResponse getQuotes(QuoteQuery query);

    BrokerResponse getHistoricalData(HistoricalQuery query);

    // ---- Orders ----

    /**
     * Places one order. The leg has already been validated and had defaults applied.
     *
     * @return envelope whose success object carries {@code order_id}
     */
    BrokerResponse placeOrder(OrderLeg leg);

    BrokerResponse cancelOrder(String exchangeCode, String orderId);

    BrokerResponse modifyOrder(OrderModification modification);

    BrokerResponse getOrderList(String exchangeCode, LocalDate fromDate, LocalDate toDate);

    BrokerResponse getTradeList(String exchangeCode, LocalDate fromDate, LocalDate toDate);

    // ---- Push feed ----

    /** Registers the single callback that receives raw tick payloads. */
    void setTickListener(TickListener listener);

    void connectFeed();

    void disconnectFeed();

    void subscribeFeed(FeedSubscription subscription);

    void unsubscribeFeed(FeedSubscription subscription);
}
