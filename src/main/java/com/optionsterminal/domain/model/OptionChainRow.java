package com.optionsterminal.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.optionsterminal.domain.enums.OptionRight;
import lombok.Builder;
import lombok.Value;

/** Flattened option record as pushed to observers. Fields never seen are reported as 0. */
@Value
@Builder
public class OptionChainRow {

    @JsonProperty("stock_code")
    String symbol;

    int strike;
    OptionRight right;
    double ltp;
    double oi;
    double volume;
    double iv;
    double bid;
    double ask;

    @JsonProperty("change_pct")
    double changePct;

    @JsonProperty("last_updated")
    double lastUpdated;

    public static OptionChainRow of(TickKey key, TickRecord record) {
        return OptionChainRow.builder()
                .symbol(key.getSymbol())
                .strike(key.getStrike())
                .right(key.getRight())
                .ltp(orZero(record.getLtp()))
                .oi(orZero(record.getOi()))
                .volume(orZero(record.getVolume()))
                .iv(orZero(record.getIv()))
                .bid(orZero(record.getBid()))
                .ask(orZero(record.getAsk()))
                .changePct(orZero(record.getChangePct()))
                .lastUpdated(record.getUpdatedAt())
                .build();
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
