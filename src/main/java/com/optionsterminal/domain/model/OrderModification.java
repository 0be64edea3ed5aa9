package com.optionsterminal.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OrderModification {

    String orderId;
    String exchangeCode;
    String quantity;
    String price;
    String stoploss;
    String validity;
}
