package com.optionsterminal.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;

import com.optionsterminal.domain.enums.OptionRight;
import com.optionsterminal.domain.model.TickKey;
import com.optionsterminal.domain.model.TickRecord;
import com.optionsterminal.marketdata.FeedTickHandler;
import com.optionsterminal.marketdata.TickCache;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FeedTickHandlerTest {

    private static final TickKey CALL_21500 = TickKey.option("NIFTY", 21500, OptionRight.CALL);

    private TickCache tickCache;
    private FeedTickHandler feedTickHandler;

    @BeforeEach
    void setUp() {
        tickCache = new TickCache(Clock.systemUTC());
        feedTickHandler = new FeedTickHandler(tickCache, 1000);
    }

    private static Map<String, Object> tick(Object... keyValues) {
        Map<String, Object> tick = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            tick.put((String) keyValues[i], keyValues[i + 1]);
        }
        return tick;
    }

    @Nested
    @DisplayName("Identity resolution")
    class Identity {

        @Test
        @DisplayName("resolves current field names")
        void currentFieldNames() {
            feedTickHandler.onTicks(List.of(tick(
                    "stock_code", "NIFTY",
                    "strike_price", "21500.0",
                    "right", "Call",
                    "last_traded_price", "101.25",
                    "open_interest", 125000,
                    "exchange_feed_time", "28-Oct-2025 10:15:00")));

            TickRecord record = tickCache.get(CALL_21500).orElseThrow();
            assertThat(record.getLtp()).isEqualTo(101.25);
            assertThat(record.getOi()).isEqualTo(125000.0);
            assertThat(record.getFeedTime()).isEqualTo("28-Oct-2025 10:15:00");
            assertThat(feedTickHandler.getAppliedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("resolves legacy field names")
        void legacyFieldNames() {
            feedTickHandler.onTicks(List.of(tick("symbol", "nifty", "strike", 21500, "option_type", "CE", "ltp", 99.5)));

            assertThat(tickCache.get(CALL_21500).orElseThrow().getLtp()).isEqualTo(99.5);
        }

        @Test
        @DisplayName("drops a tick missing its right and applies the rest of the batch")
        void dropsIncompleteTick() {
            feedTickHandler.onTicks(List.of(
                    tick("stock_code", "NIFTY", "strike_price", "21500", "ltp", 50),
                    tick("stock_code", "NIFTY", "strike_price", "21500", "right", "Put", "ltp", 60)));

            assertThat(tickCache.version()).isEqualTo(1);
            assertThat(tickCache.get(TickKey.option("NIFTY", 21500, OptionRight.PUT))).isPresent();
            assertThat(feedTickHandler.getDroppedCount()).isEqualTo(1);
            assertThat(feedTickHandler.getAppliedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("drops a tick whose strike or right does not parse")
        void dropsUnparsableIdentity() {
            feedTickHandler.onTicks(List.of(
                    tick("stock_code", "NIFTY", "strike_price", "ATM", "right", "Call"),
                    tick("stock_code", "NIFTY", "strike_price", "21500", "right", "Others")));

            assertThat(tickCache.version()).isZero();
            assertThat(feedTickHandler.getDroppedCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("ignores empty and null batches")
        void ignoresEmptyBatches() {
            feedTickHandler.onTicks(List.of());
            feedTickHandler.onTicks(null);

            assertThat(tickCache.version()).isZero();
        }
    }

    @Nested
    @DisplayName("Field merging")
    class Merging {

        @Test
        @DisplayName("fields absent from a tick keep their previous values")
        void partialTickKeepsPriorValues() {
            feedTickHandler.onTicks(List.of(tick(
                    "stock_code", "NIFTY", "strike_price", "21500", "right", "Call",
                    "last_traded_price", 100, "implied_volatility", 13.2)));
            feedTickHandler.onTicks(List.of(tick(
                    "stock_code", "NIFTY", "strike_price", "21500", "right", "Call", "last_traded_price", "",
                    "ltp", 104)));

            TickRecord record = tickCache.get(CALL_21500).orElseThrow();
            assertThat(record.getLtp()).isEqualTo(104.0);
            assertThat(record.getIv()).isEqualTo(13.2);
        }

        @Test
        @DisplayName("a field that moves to zero is written as zero")
        void zeroOverwritesPriorValue() {
            feedTickHandler.onTicks(List.of(tick(
                    "stock_code", "NIFTY", "strike_price", "21500", "right", "Call",
                    "last_traded_price", 100, "change_percent", 1.5, "best_bid_price", 99.5)));
            feedTickHandler.onTicks(List.of(tick(
                    "stock_code", "NIFTY", "strike_price", "21500", "right", "Call",
                    "change_percent", 0.0, "best_bid_price", "0")));

            TickRecord record = tickCache.get(CALL_21500).orElseThrow();
            assertThat(record.getChangePct()).isEqualTo(0.0);
            assertThat(record.getBid()).isEqualTo(0.0);
            assertThat(record.getLtp()).isEqualTo(100.0);
        }
    }

    @Nested
    @DisplayName("Spot extraction")
    class Spot {

        @Test
        @DisplayName("an underlying level above the threshold refreshes the spot record")
        void updatesSpot() {
            feedTickHandler.onTicks(List.of(tick(
                    "stock_code", "NIFTY", "strike_price", "21500", "right", "Call",
                    "last_traded_price", 100, "index_close_price", "21512.35")));

            assertThat(tickCache.spotPrice("NIFTY")).contains(21512.35);
            assertThat(tickCache.get(TickKey.spot("NIFTY")).orElseThrow().getSource()).isEqualTo("feed");
            assertThat(tickCache.version()).isEqualTo(2);
        }

        @Test
        @DisplayName("a first candidate at or below the threshold is not taken as spot")
        void rejectsPremiumLikeValues() {
            feedTickHandler.onTicks(List.of(tick(
                    "stock_code", "NIFTY", "strike_price", "21500", "right", "Call",
                    "close_price", 98.5, "index_price", "21512.35")));

            assertThat(tickCache.spotPrice("NIFTY")).isEmpty();
            assertThat(tickCache.version()).isEqualTo(1);
        }

        @Test
        @DisplayName("a zero underlying falls through to the next candidate")
        void zeroUnderlyingFallsThrough() {
            feedTickHandler.onTicks(List.of(tick(
                    "stock_code", "SENSEX", "strike_price", "80500", "right", "Put",
                    "index_close_price", 0, "underlying_value", "80512.1")));

            assertThat(tickCache.spotPrice("SENSEX")).contains(80512.1);
        }
    }
}
