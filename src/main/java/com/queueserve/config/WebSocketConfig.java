package com.queueserve.config;

import com.queueserve.api.websocket.QueueSubscriptionInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * Configures the STOMP WebSocket message broker.
 *
 * <p>Clients connect at {@code /ws} and subscribe to {@code /topic/queue} (public board),
 * {@code /topic/orders/{id}} (one order) or {@code /topic/kitchen} (kitchen display).
 * The {@link QueueSubscriptionInterceptor} on the inbound channel keeps track of who
 * is watching what.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${queueserve.cors.allowed-origin}")
    private String allowedOrigin;

    private final QueueSubscriptionInterceptor queueSubscriptionInterceptor;

    public WebSocketConfig(QueueSubscriptionInterceptor queueSubscriptionInterceptor) {
        this.queueSubscriptionInterceptor = queueSubscriptionInterceptor;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws").setAllowedOriginPatterns(allowedOrigin);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(queueSubscriptionInterceptor);
    }
}
