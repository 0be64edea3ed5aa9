package com.optionsterminal.domain.model;

import lombok.Builder;
import lombok.Value;

/** Spot level of an underlying and where it came from. */
@Value
@Builder
public class SpotQuote {

    public static final String SOURCE_FEED = "feed";
    public static final String SOURCE_REST = "rest_quote";

    String stockCode;
    String exchangeCode;
    double spot;
    String source;
}
