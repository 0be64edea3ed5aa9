package com.optionsterminal.domain.model;

import com.optionsterminal.domain.enums.OptionRight;
import lombok.Builder;
import lombok.Value;

/** Parameters of one push-feed subscribe/unsubscribe call for a single option contract. */
@Value
@Builder
public class FeedSubscription {

    String stockCode;
    String exchangeCode;
    String expiryDate;
    int strikePrice;
    OptionRight right;
}
