package com.optionsterminal.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;

import com.optionsterminal.marketdata.FieldAliasTable;
import com.optionsterminal.marketdata.TickField;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FieldAliasTableTest {

    @Test
    @DisplayName("number falls through null, blank and unparsable candidates")
    void numberFallsThrough() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("last_traded_price", null);
        payload.put("ltp", "101.5");

        assertThat(FieldAliasTable.FEED_TICK.number(payload, TickField.LTP)).hasValue(101.5);

        payload.put("last_traded_price", "n/a");
        assertThat(FieldAliasTable.FEED_TICK.number(payload, TickField.LTP)).hasValue(101.5);

        payload.put("last_traded_price", " ");
        assertThat(FieldAliasTable.FEED_TICK.numberOrNull(payload, TickField.LTP)).isEqualTo(101.5);
    }

    @Test
    @DisplayName("zero is a value and does not fall through")
    void zeroResolves() {
        Map<String, Object> payload = Map.of("change_percent", "0", "change_pct", 1.5);

        assertThat(FieldAliasTable.FEED_TICK.number(payload, TickField.CHANGE_PERCENT)).hasValue(0.0);
        assertThat(FieldAliasTable.FEED_TICK.numberOrNull(Map.of("ltp", 0), TickField.LTP)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("the first resolving candidate wins")
    void firstCandidateWins() {
        Map<String, Object> payload = Map.of("last_traded_price", 99.0, "ltp", 101.5);

        assertThat(FieldAliasTable.FEED_TICK.number(payload, TickField.LTP)).hasValue(99.0);
    }

    @Test
    @DisplayName("absent fields resolve to empty")
    void absentFieldIsEmpty() {
        Map<String, Object> payload = Map.of("stock_code", "NIFTY");

        assertThat(FieldAliasTable.FEED_TICK.number(payload, TickField.OPEN_INTEREST)).isEmpty();
        assertThat(FieldAliasTable.FEED_TICK.numberOrNull(payload, TickField.OPEN_INTEREST)).isNull();
        assertThat(FieldAliasTable.FEED_TICK.text(payload, TickField.RIGHT)).isEmpty();
    }

    @Test
    @DisplayName("text accepts numbers and trims strings")
    void textResolution() {
        assertThat(FieldAliasTable.FEED_TICK.text(Map.of("strike_price", 21500), TickField.STRIKE)).contains("21500");
        assertThat(FieldAliasTable.FEED_TICK.text(Map.of("symbol", "  NIFTY "), TickField.SYMBOL)).contains("NIFTY");
    }

    @Test
    @DisplayName("positiveNumbers keeps alias order and skips non-positive values")
    void positiveNumbersInAliasOrder() {
        Map<String, Object> payload = Map.of(
                "index_close_price", "0",
                "UnderlyingValue", "21512.4",
                "close_price", 102.0);

        assertThat(FieldAliasTable.FEED_TICK.positiveNumbers(payload, TickField.UNDERLYING))
                .containsExactly(21512.4, 102.0);
    }

    @Test
    @DisplayName("option-chain rows accept both snake and hyphen spellings")
    void optionChainSpellings() {
        Map<String, Object> hyphen = Map.of("open-interest", "1200", "best-bid-price", 10.5);

        assertThat(FieldAliasTable.OPTION_CHAIN_ROW.number(hyphen, TickField.OPEN_INTEREST)).hasValue(1200.0);
        assertThat(FieldAliasTable.OPTION_CHAIN_ROW.number(hyphen, TickField.BID)).hasValue(10.5);
        assertThat(FieldAliasTable.OPTION_CHAIN_ROW.keysFor(TickField.STRIKE))
                .containsExactly("strike_price", "strike-price");
    }

    @Test
    @DisplayName("custom tables are versioned and named")
    void customTable() {
        FieldAliasTable table = FieldAliasTable.builder("custom", 3)
                .alias(TickField.LTP, "price", "v3")
                .build();

        assertThat(table.getName()).isEqualTo("custom");
        assertThat(table.getVersion()).isEqualTo(3);
        assertThat(table.number(Map.of("price", 7), TickField.LTP)).hasValue(7.0);
        assertThat(table.number(Map.of("ltp", 7), TickField.LTP)).isEmpty();
    }
}
