package com.optionsterminal.domain.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Flattened view of one cache snapshot, shared by the relay and pull paths. */
@Value
@Builder
public class TickDelta {

    String sessionId;
    long version;
    List<OptionChainRow> ticks;
    Map<String, Double> spotPrices;
    boolean feedLive;

    public VersionStamp stamp() {
        return new VersionStamp(sessionId, version);
    }

    public static TickDelta empty() {
        return TickDelta.builder()
                .version(0)
                .ticks(List.of())
                .spotPrices(Map.of())
                .feedLive(false)
                .build();
    }
}
