package com.optionsterminal.oms;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.optionsterminal.broker.BrokerResponse;
import lombok.Builder;
import lombok.Value;

/** Outcome of a cancel or modify request. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderActionResult {

    boolean success;

    String error;

    public static OrderActionResult fromResponse(BrokerResponse response) {
        if (response != null && response.isOk()) {
            return OrderActionResult.builder().success(true).build();
        }
        return failed(response == null ? "Broker returned no response" : response.errorText());
    }

    public static OrderActionResult failed(String error) {
        return OrderActionResult.builder().success(false).error(error).build();
    }
}
