package com.optionsterminal.broker;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BrokerCredentials {

    String apiKey;
    String apiSecret;
    String sessionToken;

    @Override
    public String toString() {
        return "BrokerCredentials(apiKey=" + mask(apiKey) + ", sessionToken=" + mask(sessionToken) + ")";
    }

    public static String mask(String secret) {
        if (secret == null || secret.length() < 4) {
            return "****";
        }
        return secret.substring(0, 4) + "****";
    }
}
