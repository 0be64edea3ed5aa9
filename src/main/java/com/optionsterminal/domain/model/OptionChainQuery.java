package com.optionsterminal.domain.model;

import com.optionsterminal.domain.enums.OptionRight;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OptionChainQuery {

    String stockCode;
    String exchangeCode;
    String expiryDate;
    OptionRight right;

    /** Blank for the whole chain. */
    String strikePrice;
}
