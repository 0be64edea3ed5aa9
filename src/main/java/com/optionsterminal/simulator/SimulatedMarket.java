package com.optionsterminal.simulator;

import com.optionsterminal.config.GatewayProperties;
import com.optionsterminal.domain.enums.OptionRight;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Toy price model for paper trading: a random-walking spot per underlying and option
 * premiums of intrinsic value plus a time value that decays away from the money.
 */
public class SimulatedMarket {

    static final double DEFAULT_SPOT = 20_000;

    private static final double WALK_STDDEV = 0.0005;
    private static final double ATM_TIME_VALUE = 120;
    private static final double MIN_TIME_VALUE = 0.5;
    private static final double DECAY_POINTS = 400;

    private final Map<String, Double> spots = new ConcurrentHashMap<>();
    private final Map<String, Double> openingSpots = new ConcurrentHashMap<>();
    private final int strikeStep;
    private final int strikesEachSide;
    private final Random random;

    public SimulatedMarket(GatewayProperties.Simulator config, long seed) {
        config.getBaseSpots().forEach((symbol, spot) -> {
            spots.put(symbol.toUpperCase(Locale.ROOT), spot);
            openingSpots.put(symbol.toUpperCase(Locale.ROOT), spot);
        });
        this.strikeStep = config.getStrikeStep();
        this.strikesEachSide = config.getStrikesEachSide();
        this.random = new Random(seed);
    }

    public double spot(String symbol) {
        String key = symbol.toUpperCase(Locale.ROOT);
        return spots.computeIfAbsent(key, k -> {
            openingSpots.putIfAbsent(k, DEFAULT_SPOT);
            return DEFAULT_SPOT;
        });
    }

    /** Moves the spot one random step and returns the new level. */
    public synchronized double walk(String symbol) {
        double next = spot(symbol) * (1 + random.nextGaussian() * WALK_STDDEV);
        spots.put(symbol.toUpperCase(Locale.ROOT), next);
        return next;
    }

    public double changePercent(String symbol) {
        double opening = openingSpots.getOrDefault(symbol.toUpperCase(Locale.ROOT), DEFAULT_SPOT);
        return round2((spot(symbol) - opening) / opening * 100);
    }

    public double premium(String symbol, int strike, OptionRight right) {
        double spot = spot(symbol);
        double intrinsic = right == OptionRight.CALL ? Math.max(spot - strike, 0) : Math.max(strike - spot, 0);
        double timeValue = Math.max(MIN_TIME_VALUE, ATM_TIME_VALUE * Math.exp(-Math.abs(spot - strike) / DECAY_POINTS));
        return round2(intrinsic + timeValue);
    }

    /** Rough implied volatility smile: higher away from the money. */
    public double impliedVolatility(String symbol, int strike) {
        double moneyness = Math.abs(spot(symbol) - strike) / spot(symbol);
        return round2(12 + moneyness * 150);
    }

    public int atmStrike(String symbol) {
        return (int) (Math.round(spot(symbol) / strikeStep) * strikeStep);
    }

    public int getStrikeStep() {
        return strikeStep;
    }

    public int getStrikesEachSide() {
        return strikesEachSide;
    }

    static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
