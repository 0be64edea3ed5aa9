package com.optionsterminal.config;

import com.optionsterminal.api.websocket.TickRelayHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/** Registers the raw WebSocket tick relay at {@code /ws/ticks}. */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final TickRelayHandler tickRelayHandler;
    private final GatewayProperties gatewayProperties;

    public WebSocketConfig(TickRelayHandler tickRelayHandler, GatewayProperties gatewayProperties) {
        this.tickRelayHandler = tickRelayHandler;
        this.gatewayProperties = gatewayProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(tickRelayHandler, "/ws/ticks")
                .setAllowedOriginPatterns(gatewayProperties.getCors().getAllowedOrigin());
    }
}
