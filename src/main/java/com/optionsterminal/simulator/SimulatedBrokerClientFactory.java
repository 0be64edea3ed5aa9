package com.optionsterminal.simulator;

import com.optionsterminal.broker.BrokerClient;
import com.optionsterminal.broker.BrokerClientFactory;
import com.optionsterminal.broker.BrokerCredentials;
import com.optionsterminal.config.GatewayProperties;
import com.optionsterminal.exception.BrokerException;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Paper-trading broker, active when {@code gateway.broker.mode=PAPER} (the default).
 * Accepts any non-blank credentials; every session starts from the configured base spots
 * with an empty order book.
 */
@Component
@ConditionalOnProperty(prefix = "gateway.broker", name = "mode", havingValue = "PAPER", matchIfMissing = true)
public class SimulatedBrokerClientFactory implements BrokerClientFactory {

    private static final Logger log = LoggerFactory.getLogger(SimulatedBrokerClientFactory.class);

    private final GatewayProperties properties;
    private final Clock clock;

    public SimulatedBrokerClientFactory(GatewayProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public BrokerClient createSession(BrokerCredentials credentials) {
        if (isBlank(credentials.getApiKey()) || isBlank(credentials.getApiSecret())
                || isBlank(credentials.getSessionToken())) {
            throw new BrokerException("Session rejected: api key, secret and session token are required");
        }
        GatewayProperties.Simulator config = properties.getSimulator();
        String sessionKey = "SIM-" + UUID.randomUUID();
        log.info("Paper broker session created for {}", credentials);
        return new SimulatedBrokerClient(
                sessionKey, new SimulatedMarket(config, clock.millis()), clock, config.getTickIntervalMs());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
