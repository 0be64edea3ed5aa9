package com.optionsterminal.api.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.optionsterminal.domain.model.OptionChainRow;
import com.optionsterminal.domain.model.TickDelta;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Frame pushed to relay observers. Two types:
 * <ul>
 *   <li>{@code tick_update}: version, option-chain rows, spot prices, server time, feed liveness</li>
 *   <li>{@code heartbeat}: server time and feed liveness only</li>
 * </ul>
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RelayFrame {

    public static final String TYPE_TICK_UPDATE = "tick_update";
    public static final String TYPE_HEARTBEAT = "heartbeat";

    String type;
    Long version;
    List<OptionChainRow> ticks;

    @JsonProperty("spot_prices")
    Map<String, Double> spotPrices;

    /** Server time, epoch seconds. */
    double ts;

    boolean feedLive;

    public static RelayFrame tickUpdate(TickDelta delta, double ts) {
        return RelayFrame.builder()
                .type(TYPE_TICK_UPDATE)
                .version(delta.getVersion())
                .ticks(delta.getTicks())
                .spotPrices(delta.getSpotPrices())
                .ts(ts)
                .feedLive(delta.isFeedLive())
                .build();
    }

    public static RelayFrame heartbeat(boolean feedLive, double ts) {
        return RelayFrame.builder().type(TYPE_HEARTBEAT).ts(ts).feedLive(feedLive).build();
    }
}
