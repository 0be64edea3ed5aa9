package com.optionsterminal.api.controller;

import com.optionsterminal.api.dto.request.SubscribeRequest;
import com.optionsterminal.api.dto.response.OptionChainResponse;
import com.optionsterminal.api.dto.response.SubscribeResponse;
import com.optionsterminal.api.dto.response.TickPollResponse;
import com.optionsterminal.calendar.ExpiryCalendarService;
import com.optionsterminal.calendar.ExpiryDate;
import com.optionsterminal.domain.enums.OptionRight;
import com.optionsterminal.domain.model.OptionChainQuery;
import com.optionsterminal.domain.model.QuoteQuery;
import com.optionsterminal.domain.model.SpotQuote;
import com.optionsterminal.service.TickDeltaService;
import com.optionsterminal.session.BrokerSession;
import com.optionsterminal.session.BrokerSessionManager;
import com.optionsterminal.session.SubscriptionResult;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Market data: expiries, spot, option chain, quotes, push-feed subscriptions and the
 * tick pull endpoint.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/expiries -- next weekly expiries for an underlying (no broker call)</li>
 *   <li>GET /api/spot -- underlying level, from the feed cache or a paced REST quote</li>
 *   <li>GET /api/optionchain -- one side of the chain; seeds the tick cache</li>
 *   <li>GET /api/quote -- single paced REST quote</li>
 *   <li>POST /api/ws/subscribe -- replace the push-feed subscription set</li>
 *   <li>GET /api/ticks -- version-gated pull of the cache delta</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class MarketDataController {

    private static final Logger log = LoggerFactory.getLogger(MarketDataController.class);

    private final BrokerSessionManager brokerSessionManager;
    private final ExpiryCalendarService expiryCalendarService;
    private final TickDeltaService tickDeltaService;

    public MarketDataController(
            BrokerSessionManager brokerSessionManager,
            ExpiryCalendarService expiryCalendarService,
            TickDeltaService tickDeltaService) {
        this.brokerSessionManager = brokerSessionManager;
        this.expiryCalendarService = expiryCalendarService;
        this.tickDeltaService = tickDeltaService;
    }

    @GetMapping("/expiries")
    public ResponseEntity<Map<String, Object>> expiries(
            @RequestParam(name = "stock_code", defaultValue = "NIFTY") String stockCode,
            @RequestParam(name = "count", defaultValue = "" + ExpiryCalendarService.DEFAULT_COUNT) int count) {
        List<ExpiryDate> expiries = expiryCalendarService.weeklyExpiries(stockCode, count);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stockCode", stockCode);
        body.put("expiries", expiries);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/spot")
    public ResponseEntity<SpotQuote> spot(
            @RequestParam(name = "stock_code", defaultValue = "NIFTY") String stockCode,
            @RequestParam(name = "exchange_code", defaultValue = "NSE") String exchangeCode) {
        BrokerSession session = brokerSessionManager.requireSession();
        return ResponseEntity.ok(session.spotPrice(stockCode, exchangeCode));
    }

    @GetMapping("/optionchain")
    public ResponseEntity<OptionChainResponse> optionChain(
            @RequestParam(name = "stock_code", defaultValue = "NIFTY") String stockCode,
            @RequestParam(name = "exchange_code", defaultValue = "NFO") String exchangeCode,
            @RequestParam(name = "expiry_date") String expiryDate,
            @RequestParam(name = "right", defaultValue = "Call") String right,
            @RequestParam(name = "strike_price", defaultValue = "") String strikePrice) {
        BrokerSession session = brokerSessionManager.requireSession();
        OptionChainQuery query = OptionChainQuery.builder()
                .stockCode(stockCode)
                .exchangeCode(exchangeCode)
                .expiryDate(expiryDate)
                .right(OptionRight.parse(right))
                .strikePrice(strikePrice)
                .build();
        List<Map<String, Object>> rows = session.fetchOptionChain(query);
        return ResponseEntity.ok(OptionChainResponse.builder()
                .data(rows)
                .count(rows.size())
                .cacheVersion(session.getTickCache().version())
                .build());
    }

    @GetMapping("/quote")
    public ResponseEntity<List<Map<String, Object>>> quote(
            @RequestParam(name = "stock_code") String stockCode,
            @RequestParam(name = "exchange_code") String exchangeCode,
            @RequestParam(name = "expiry_date") String expiryDate,
            @RequestParam(name = "right") String right,
            @RequestParam(name = "strike_price") String strikePrice) {
        BrokerSession session = brokerSessionManager.requireSession();
        QuoteQuery query = QuoteQuery.builder()
                .stockCode(stockCode)
                .exchangeCode(exchangeCode)
                .expiryDate(expiryDate)
                .right(OptionRight.parse(right).brokerName())
                .strikePrice(strikePrice)
                .build();
        return ResponseEntity.ok(session.quote(query));
    }

    /** Unsubscribes everything, then subscribes the requested strikes for one expiry. */
    @PostMapping("/ws/subscribe")
    public ResponseEntity<SubscribeResponse> subscribe(@Valid @RequestBody SubscribeRequest request) {
        BrokerSession session = brokerSessionManager.requireSession();
        int unsubscribed = session.unsubscribeAll();
        SubscriptionResult result = session.subscribeOptionChain(
                request.getStockCode(),
                request.getExchangeCode(),
                request.getExpiryDate(),
                request.getStrikes(),
                request.getRights());
        log.info(
                "Feed subscription replaced for {} {}: -{} +{}, {} errors",
                request.getStockCode(),
                request.getExpiryDate(),
                unsubscribed,
                result.getSubscribed(),
                result.getErrors().size());
        return ResponseEntity.ok(SubscribeResponse.of(unsubscribed, result));
    }

    /** Answers "unchanged" when {@code sinceVersion} equals the current cache version. */
    @GetMapping("/ticks")
    public ResponseEntity<TickPollResponse> ticks(
            @RequestParam(name = "sinceVersion", defaultValue = "0") long sinceVersion) {
        return ResponseEntity.ok(tickDeltaService.poll(sinceVersion));
    }
}
