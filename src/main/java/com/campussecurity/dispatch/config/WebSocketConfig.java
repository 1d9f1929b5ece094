package com.campussecurity.dispatch.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over WebSocket for the guard mobile app and the operator dashboard.
 *
 * Endpoints:
 * - /ws/dispatch: connection endpoint (SockJS fallback registered alongside)
 * - /app/guard/location: guards send beacon pings here
 * - /user/{guardId}/queue/alerts: incident alerts and assignment updates for one guard
 * - /user/{guardId}/queue/reply: ping acknowledgements
 * - /topic/incidents: incident state broadcasts for dashboards
 */
@Configuration
@EnableWebSocketMessageBroker
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final DispatchProperties properties;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic", "/queue");
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        String endpoint = properties.websocket().endpoint();
        String allowedOrigins = properties.websocket().allowedOrigins();

        registry.addEndpoint(endpoint)
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();

        // Native WebSocket clients (the guard app) connect without SockJS
        registry.addEndpoint(endpoint)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
