package com.optionsterminal.marketdata;

/** Logical fields the gateway reads out of broker market-data payloads. */
public enum TickField {
    SYMBOL,
    STRIKE,
    RIGHT,
    LTP,
    OPEN_INTEREST,
    VOLUME,
    IMPLIED_VOLATILITY,
    BID,
    ASK,
    CHANGE_PERCENT,
    FEED_TIME,
    UNDERLYING
}
