package com.optionsterminal.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the gateway, bound to the {@code gateway.*} prefix.
 *
 * <p>Every timing default mirrors the broker's published limit of 100 REST calls per
 * minute: one call per 600ms, a 50-item pending queue, and a 45s caller wait.
 */
@Configuration
@ConfigurationProperties(prefix = "gateway")
@Getter
@Setter
public class GatewayProperties {

    private Pacing pacing = new Pacing();

    private Relay relay = new Relay();

    private Orders orders = new Orders();

    private Feed feed = new Feed();

    private Broker broker = new Broker();

    private Simulator simulator = new Simulator();

    private Cors cors = new Cors();

    @Getter
    @Setter
    public static class Pacing {

        /** Minimum spacing between the start times of two consecutive broker calls. */
        private long minIntervalMs = 600;

        /** Maximum number of pending work items before drop-oldest eviction kicks in. */
        private int capacity = 50;

        /** How long a submitting caller waits for its work to execute. */
        private long callerTimeoutMs = 45_000;

        /** Broker-side limit, reported by the rate-status query. */
        private int maxPerMinute = 100;

        /** Size of the ring buffer of recent execution timestamps. */
        private int historySize = 100;
    }

    @Getter
    @Setter
    public static class Relay {

        private long pollIntervalMs = 500;

        /** Emit a heartbeat every Nth unchanged poll. */
        private int heartbeatEvery = 10;

        private int schedulerPoolSize = 4;
    }

    @Getter
    @Setter
    public static class Orders {

        /** Per-leg join timeout for multi-leg submissions. */
        private long legJoinTimeoutMs = 60_000;

        private int legPoolSize = 8;

        private String defaultRemark = "OptionsTerminal";

        private String squareOffRemark = "SquareOff_OptionsTerminal";
    }

    @Getter
    @Setter
    public static class Feed {

        /** Underlying values at or below this are not accepted as a spot price. */
        private double spotThreshold = 1000;

        /** Pause between consecutive push-feed subscribe calls. */
        private long subscribeSpacingMs = 50;
    }

    @Getter
    @Setter
    public static class Broker {

        /** PAPER wires the in-memory simulator; LIVE expects an external BrokerClientFactory bean. */
        private String mode = "PAPER";
    }

    @Getter
    @Setter
    public static class Simulator {

        /** Interval between simulated push ticks per subscribed instrument batch. */
        private long tickIntervalMs = 1000;

        /** Index level the simulated option chain is centred on, per symbol. */
        private Map<String, Double> baseSpots = new LinkedHashMap<>(Map.of("NIFTY", 24500.0, "SENSEX", 80500.0));

        private int strikeStep = 50;

        private int strikesEachSide = 10;
    }

    @Getter
    @Setter
    public static class Cors {

        private String allowedOrigin = "*";
    }
}
