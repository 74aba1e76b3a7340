package com.chicu.aimonitor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

@Slf4j
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    public static final String RETRAINING_ENDPOINT = "/ws/retraining";

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {

        registry.addEndpoint(RETRAINING_ENDPOINT)
                .setAllowedOriginPatterns("*")
                .withSockJS();

        registry.addEndpoint(RETRAINING_ENDPOINT)
                .setAllowedOriginPatterns("*");

        log.info("✅ WebSocket STOMP endpoint {} зарегистрирован", RETRAINING_ENDPOINT);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {

        config.enableSimpleBroker("/topic");
        config.setApplicationDestinationPrefixes("/app");

        log.info("✅ SimpleBroker включён на /topic");
    }
}
