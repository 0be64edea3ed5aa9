package com.optionsterminal.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CancelOrderRequest {

    @NotBlank(message = "orderId is required")
    @JsonAlias("order_id")
    private String orderId;

    @JsonAlias("exchange_code")
    private String exchangeCode = "NFO";
}
