package com.optionsterminal.api.dto.response;

import lombok.Builder;
import lombok.Value;

/** Liveness summary. Never fails, with or without a broker session. */
@Value
@Builder
public class HealthResponse {

    public static final String STATUS_ONLINE = "online";

    String status;
    boolean connected;
    boolean feedLive;
    int subscriptions;
    int tickCount;
    int restCallsMin;
    int queueDepth;
    String version;

    /** Epoch seconds. */
    double timestamp;
}
