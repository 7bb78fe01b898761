package com.connectfood.backend.modules.telemetry.infrastructure;

import com.connectfood.backend.modules.telemetry.application.FreshnessFeedHandler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class TelemetryWebSocketConfig implements WebSocketConfigurer {

    private final FreshnessFeedHandler freshnessFeedHandler;
    private final String[] allowedOrigins;

    public TelemetryWebSocketConfig(
            FreshnessFeedHandler freshnessFeedHandler,
            @Value("${app.cors.allowed-origins:*}") String allowedOrigins
    ) {
        this.freshnessFeedHandler = freshnessFeedHandler;
        this.allowedOrigins = allowedOrigins.split(",");
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(freshnessFeedHandler, "/ws/freshness/*")
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
