package com.optionsterminal.api.dto.request;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.optionsterminal.oms.LenientOrderLegDeserializer;
import com.optionsterminal.oms.OrderLeg;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.Data;

/** Legs are validated one by one at submission so that a bad leg fails alone. */
@Data
public class StrategyExecuteRequest {

    @NotEmpty(message = "legs must not be empty")
    @JsonDeserialize(contentUsing = LenientOrderLegDeserializer.class)
    private List<OrderLeg> legs;
}
