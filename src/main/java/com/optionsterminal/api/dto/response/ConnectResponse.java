package com.optionsterminal.api.dto.response;

import com.optionsterminal.session.SessionInfo;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConnectResponse {

    String sessionId;

    /** Masked broker session key. */
    String sessionToken;

    String message;
    String name;
    String email;

    public static ConnectResponse from(SessionInfo info) {
        return ConnectResponse.builder()
                .sessionId(info.getSessionId())
                .sessionToken(info.getSessionKey())
                .message("Connected to broker")
                .name(info.getName())
                .email(info.getEmail())
                .build();
    }
}
