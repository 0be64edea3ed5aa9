package com.optionsterminal.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.optionsterminal.broker.BrokerCredentials;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Broker credentials for opening a session. Accepts the broker's snake_case names
 * ({@code api_key}, {@code api_secret}, {@code session_token} or {@code apisession}).
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ConnectRequest {

    @NotBlank(message = "apiKey is required")
    @JsonAlias("api_key")
    private String apiKey;

    @NotBlank(message = "apiSecret is required")
    @JsonAlias("api_secret")
    private String apiSecret;

    @NotBlank(message = "sessionToken is required")
    @JsonAlias({"session_token", "apisession"})
    private String sessionToken;

    public BrokerCredentials toCredentials() {
        return BrokerCredentials.builder()
                .apiKey(apiKey.trim())
                .apiSecret(apiSecret.trim())
                .sessionToken(sessionToken.trim())
                .build();
    }
}
