package com.optionsterminal.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HistoricalQuery {

    String stockCode;
    String exchangeCode;

    /** Broker interval name, e.g. "1minute", "5minute", "1day". */
    String interval;

    String fromDate;
    String toDate;

    /** Option contract selectors; blank for the underlying. */
    String expiryDate;

    String right;
    String strikePrice;

    public boolean isOptionContract() {
        return expiryDate != null && !expiryDate.isBlank();
    }
}
