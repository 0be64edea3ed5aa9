package com.optionsterminal.observability;

import com.optionsterminal.api.websocket.TickRelayHandler;
import com.optionsterminal.session.BrokerSession;
import com.optionsterminal.session.BrokerSessionManager;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.ToDoubleFunction;
import org.springframework.stereotype.Service;

/**
 * Gateway gauges. All are lazily evaluated by Micrometer on scrape and read the current
 * session, reporting 0 when none is open:
 * <ul>
 *   <li><b>pacing.queue.depth</b>: broker calls waiting on the pacing lane</li>
 *   <li><b>pacing.calls.last.minute</b>: broker calls started in the trailing 60s</li>
 *   <li><b>tick.cache.version</b>: current cache version</li>
 *   <li><b>tick.cache.size</b>: records in the cache, spot records included</li>
 *   <li><b>feed.subscriptions</b>: active push-feed subscriptions</li>
 *   <li><b>session.connected</b> / <b>feed.live</b>: 0/1 flags</li>
 *   <li><b>relay.observers</b>: connected WebSocket observers</li>
 * </ul>
 */
@Service
public class GatewayMetrics {

    private final BrokerSessionManager brokerSessionManager;

    public GatewayMetrics(
            MeterRegistry meterRegistry, BrokerSessionManager brokerSessionManager, TickRelayHandler tickRelayHandler) {
        this.brokerSessionManager = brokerSessionManager;

        Gauge.builder("pacing.queue.depth", this, m -> m.sessionValue(s -> s.getPacingQueue().queueDepth()))
                .description("Broker calls waiting on the pacing lane")
                .register(meterRegistry);
        Gauge.builder("pacing.calls.last.minute", this, m -> m.sessionValue(s -> s.getPacingQueue().callsLastMinute()))
                .description("Broker calls started in the trailing 60 seconds")
                .register(meterRegistry);
        Gauge.builder("tick.cache.version", this, m -> m.sessionValue(s -> s.getTickCache().version()))
                .description("Current tick cache version")
                .register(meterRegistry);
        Gauge.builder("tick.cache.size", this, m -> m.sessionValue(s -> s.getTickCache().size()))
                .register(meterRegistry);
        Gauge.builder("feed.subscriptions", this, m -> m.sessionValue(BrokerSession::subscriptionCount))
                .register(meterRegistry);
        Gauge.builder("session.connected", brokerSessionManager, manager -> manager.isConnected() ? 1.0 : 0.0)
                .register(meterRegistry);
        Gauge.builder("feed.live", this, m -> m.sessionValue(s -> s.isFeedLive() ? 1 : 0))
                .register(meterRegistry);
        Gauge.builder("relay.observers", tickRelayHandler, TickRelayHandler::observerCount)
                .description("Connected tick relay observers")
                .register(meterRegistry);
    }

    double sessionValue(ToDoubleFunction<BrokerSession> reader) {
        return brokerSessionManager.currentSession().map(reader::applyAsDouble).orElse(0.0);
    }
}
