package com.optionsterminal.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.optionsterminal.domain.model.OptionChainRow;
import com.optionsterminal.domain.model.TickDelta;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Pull-path answer: either "unchanged" with the current version, or the full delta. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TickPollResponse {

    boolean changed;
    long version;
    List<OptionChainRow> ticks;

    @JsonProperty("spot_prices")
    Map<String, Double> spotPrices;

    Boolean feedLive;

    public static TickPollResponse unchanged(long version) {
        return TickPollResponse.builder().changed(false).version(version).build();
    }

    public static TickPollResponse changed(TickDelta delta) {
        return TickPollResponse.builder()
                .changed(true)
                .version(delta.getVersion())
                .ticks(delta.getTicks())
                .spotPrices(delta.getSpotPrices())
                .feedLive(delta.isFeedLive())
                .build();
    }
}
