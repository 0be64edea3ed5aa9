package com.optionsterminal.session;

import lombok.Builder;
import lombok.Value;

/** Summary of a freshly opened session. Name and email are empty when the broker did not provide them. */
@Value
@Builder
public class SessionInfo {

    String sessionId;

    /** Broker session key, masked. */
    String sessionKey;

    String name;
    String email;
    double connectedAt;
}
