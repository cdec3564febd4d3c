package com.phoenixdash.app.websocket;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the payment event endpoint at /ws.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final PaymentEventBroadcaster broadcaster;

    public WebSocketConfig(PaymentEventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(paymentEventWebSocketHandler(), "/ws")
                .setAllowedOrigins("*");
    }

    @Bean
    public PaymentEventWebSocketHandler paymentEventWebSocketHandler() {
        return new PaymentEventWebSocketHandler(broadcaster);
    }
}
