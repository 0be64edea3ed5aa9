package com.optionsterminal.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Quote lookup. Expiry, right and strike are blank when quoting the underlying index
 * on the cash segment.
 */
@Value
@Builder
public class QuoteQuery {

    String stockCode;
    String exchangeCode;
    String expiryDate;
    String right;
    String strikePrice;
    String productType;
}
