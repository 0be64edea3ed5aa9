package com.optionsterminal.oms;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.optionsterminal.broker.BrokerResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Outcome of submitting one leg of a strategy. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LegResult {

    @JsonProperty("leg_index")
    private int legIndex;

    private boolean success;

    @JsonProperty("order_id")
    private String orderId;

    private String error;

    /** Broker envelope as received, absent when the leg never reached the broker. */
    private BrokerResponse raw;

    public static LegResult fromResponse(int legIndex, BrokerResponse response) {
        if (response == null) {
            return failed(legIndex, "Broker returned no response");
        }
        if (response.isOk()) {
            return LegResult.builder()
                    .legIndex(legIndex)
                    .success(true)
                    .orderId(response.orderId().orElse(""))
                    .raw(response)
                    .build();
        }
        return LegResult.builder()
                .legIndex(legIndex)
                .success(false)
                .error(response.errorText())
                .raw(response)
                .build();
    }

    public static LegResult failed(int legIndex, String reason) {
        return LegResult.builder().legIndex(legIndex).success(false).error(reason).build();
    }
}
