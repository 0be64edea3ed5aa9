package com.optionsterminal.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.optionsterminal.domain.model.OrderModification;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/** Fields left out keep the broker's "no change" values: zero for numbers, day validity. */
@Data
public class ModifyOrderRequest {

    @NotBlank(message = "orderId is required")
    @JsonAlias("order_id")
    private String orderId;

    @JsonAlias("exchange_code")
    private String exchangeCode = "NFO";

    private String quantity = "0";

    private String price = "0";

    private String stoploss = "0";

    private String validity = "day";

    public OrderModification toModification() {
        return OrderModification.builder()
                .orderId(orderId)
                .exchangeCode(exchangeCode)
                .quantity(quantity)
                .price(price)
                .stoploss(stoploss)
                .validity(validity)
                .build();
    }
}
