package me.fablestack.mechanics.adapter.inbound.web.config;

import lombok.RequiredArgsConstructor;
import me.fablestack.mechanics.adapter.inbound.web.WebSocketTurnHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;

import java.util.Map;

/**
 * WebSocket endpoint configuration for turn streaming.
 */
@Configuration
@RequiredArgsConstructor
public class WebSocketConfig {

    private final WebSocketTurnHandler webSocketTurnHandler;

    @Bean
    public HandlerMapping webSocketHandlerMapping() {
        SimpleUrlHandlerMapping mapping = new SimpleUrlHandlerMapping();
        mapping.setUrlMap(Map.of("/ws/turns", webSocketTurnHandler));
        mapping.setOrder(-1);
        return mapping;
    }

    @Bean
    public WebSocketHandlerAdapter webSocketHandlerAdapter() {
        return new WebSocketHandlerAdapter();
    }
}
