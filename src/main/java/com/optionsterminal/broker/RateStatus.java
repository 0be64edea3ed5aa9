package com.optionsterminal.broker;

import lombok.Builder;
import lombok.Value;

/** Point-in-time view of a pacing lane, reported by the rate-status query. */
@Value
@Builder
public class RateStatus {

    int callsLastMinute;
    int maxPerMinute;
    long minIntervalMs;
    int queueDepth;
}
