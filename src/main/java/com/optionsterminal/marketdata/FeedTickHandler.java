package com.optionsterminal.marketdata;

import com.optionsterminal.broker.TickListener;
import com.optionsterminal.domain.enums.OptionRight;
import com.optionsterminal.domain.model.TickKey;
import com.optionsterminal.domain.model.TickUpdate;
import com.optionsterminal.exception.MalformedTickException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Push-feed callback that normalizes raw broker ticks into cache updates.
 *
 * <p>Runs on the broker SDK's callback thread and never throws back into it: a tick
 * missing its symbol, strike or right is dropped with a warning and the rest of the batch
 * is still applied. When a tick carries a plausible underlying level it also refreshes
 * the symbol's spot record.
 */
public class FeedTickHandler implements TickListener {

    private static final Logger log = LoggerFactory.getLogger(FeedTickHandler.class);

    static final String SOURCE_FEED = "feed";

    private final TickCache tickCache;
    private final FieldAliasTable aliases;
    private final double spotThreshold;

    private final AtomicLong appliedCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();

    public FeedTickHandler(TickCache tickCache, double spotThreshold) {
        this(tickCache, FieldAliasTable.FEED_TICK, spotThreshold);
    }

    public FeedTickHandler(TickCache tickCache, FieldAliasTable aliases, double spotThreshold) {
        this.tickCache = tickCache;
        this.aliases = aliases;
        this.spotThreshold = spotThreshold;
    }

    @Override
    public void onTicks(List<Map<String, Object>> ticks) {
        if (ticks == null || ticks.isEmpty()) {
            return;
        }
        for (Map<String, Object> tick : ticks) {
            try {
                apply(tick);
                appliedCount.incrementAndGet();
            } catch (MalformedTickException e) {
                droppedCount.incrementAndGet();
                log.warn("Dropped feed tick: {}", e.getMessage());
            } catch (RuntimeException e) {
                droppedCount.incrementAndGet();
                log.warn("Failed to apply feed tick {}: {}", tick, e.getMessage());
            }
        }
    }

    /**
     * Applies one raw tick to the cache.
     *
     * @throws MalformedTickException if the tick cannot be resolved to an option identity
     */
    void apply(Map<String, Object> tick) {
        if (tick == null) {
            throw new MalformedTickException("tick is null");
        }
        String symbol = aliases.text(tick, TickField.SYMBOL)
                .orElseThrow(() -> missing(TickField.SYMBOL));
        String rawStrike = aliases.text(tick, TickField.STRIKE)
                .orElseThrow(() -> missing(TickField.STRIKE));
        String rawRight = aliases.text(tick, TickField.RIGHT)
                .orElseThrow(() -> missing(TickField.RIGHT));

        int strike;
        OptionRight right;
        try {
            strike = TickKey.parseStrike(rawStrike);
            right = OptionRight.parse(rawRight);
        } catch (IllegalArgumentException e) {
            throw new MalformedTickException(
                    "unresolvable identity " + symbol + "/" + rawStrike + "/" + rawRight + ": " + e.getMessage());
        }

        TickUpdate update = TickUpdate.builder()
                .ltp(aliases.numberOrNull(tick, TickField.LTP))
                .oi(aliases.numberOrNull(tick, TickField.OPEN_INTEREST))
                .volume(aliases.numberOrNull(tick, TickField.VOLUME))
                .iv(aliases.numberOrNull(tick, TickField.IMPLIED_VOLATILITY))
                .bid(aliases.numberOrNull(tick, TickField.BID))
                .ask(aliases.numberOrNull(tick, TickField.ASK))
                .changePct(aliases.numberOrNull(tick, TickField.CHANGE_PERCENT))
                .feedTime(aliases.text(tick, TickField.FEED_TIME).orElse(null))
                .build();
        tickCache.update(TickKey.option(symbol, strike, right), update);

        underlyingLevel(tick).ifPresent(spot -> tickCache.update(
                TickKey.spot(symbol),
                TickUpdate.builder().ltp(spot).source(SOURCE_FEED).build()));
    }

    /**
     * Best-effort spot extraction: the first positive underlying candidate, accepted only
     * above the threshold so option premiums echoed in the same fields are not mistaken
     * for index levels.
     */
    Optional<Double> underlyingLevel(Map<String, Object> tick) {
        List<Double> candidates = aliases.positiveNumbers(tick, TickField.UNDERLYING);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        double first = candidates.get(0);
        return first > spotThreshold ? Optional.of(first) : Optional.empty();
    }

    public long getAppliedCount() {
        return appliedCount.get();
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    private MalformedTickException missing(TickField field) {
        return new MalformedTickException("no " + field + " under any of " + aliases.keysFor(field));
    }
}
