package com.bko.controltower.config;

import com.bko.controltower.stream.ObserverWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ObserverWebSocketHandler observerWebSocketHandler;

    public WebSocketConfig(ObserverWebSocketHandler observerWebSocketHandler) {
        this.observerWebSocketHandler = observerWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(observerWebSocketHandler, "/ws")
                .setAllowedOrigins("*");
    }
}
