package com.optionsterminal.api.controller;

import com.optionsterminal.broker.RateStatus;
import com.optionsterminal.config.GatewayProperties;
import com.optionsterminal.domain.model.HistoricalQuery;
import com.optionsterminal.domain.model.PortfolioSnapshot;
import com.optionsterminal.session.BrokerSession;
import com.optionsterminal.session.BrokerSessionManager;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Account reads and pacing status.
 *
 * <ul>
 *   <li>GET /api/positions -- open positions and holdings</li>
 *   <li>GET /api/funds</li>
 *   <li>GET /api/historical -- OHLCV candles for an underlying or an option contract</li>
 *   <li>GET /api/ratelimit -- pacing lane load; answers while disconnected</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class PortfolioController {

    private final BrokerSessionManager brokerSessionManager;
    private final GatewayProperties properties;

    public PortfolioController(BrokerSessionManager brokerSessionManager, GatewayProperties properties) {
        this.brokerSessionManager = brokerSessionManager;
        this.properties = properties;
    }

    @GetMapping("/positions")
    public ResponseEntity<PortfolioSnapshot> positions() {
        return ResponseEntity.ok(brokerSessionManager.requireSession().positions());
    }

    @GetMapping("/funds")
    public ResponseEntity<Map<String, Object>> funds() {
        return ResponseEntity.ok(brokerSessionManager.requireSession().funds());
    }

    @GetMapping("/historical")
    public ResponseEntity<List<Map<String, Object>>> historical(
            @RequestParam(name = "stock_code") String stockCode,
            @RequestParam(name = "exchange_code") String exchangeCode,
            @RequestParam(name = "interval", defaultValue = "1day") String interval,
            @RequestParam(name = "from_date") String fromDate,
            @RequestParam(name = "to_date") String toDate,
            @RequestParam(name = "expiry_date", defaultValue = "") String expiryDate,
            @RequestParam(name = "right", defaultValue = "") String right,
            @RequestParam(name = "strike_price", defaultValue = "") String strikePrice) {
        BrokerSession session = brokerSessionManager.requireSession();
        HistoricalQuery query = HistoricalQuery.builder()
                .stockCode(stockCode)
                .exchangeCode(exchangeCode)
                .interval(interval)
                .fromDate(fromDate)
                .toDate(toDate)
                .expiryDate(expiryDate)
                .right(right)
                .strikePrice(strikePrice)
                .build();
        return ResponseEntity.ok(session.historical(query));
    }

    @GetMapping("/ratelimit")
    public ResponseEntity<RateStatus> rateLimit() {
        RateStatus status = brokerSessionManager
                .currentSession()
                .map(BrokerSession::rateStatus)
                .orElseGet(this::idleRateStatus);
        return ResponseEntity.ok(status);
    }

    private RateStatus idleRateStatus() {
        GatewayProperties.Pacing pacing = properties.getPacing();
        return RateStatus.builder()
                .callsLastMinute(0)
                .maxPerMinute(pacing.getMaxPerMinute())
                .minIntervalMs(pacing.getMinIntervalMs())
                .queueDepth(0)
                .build();
    }
}
