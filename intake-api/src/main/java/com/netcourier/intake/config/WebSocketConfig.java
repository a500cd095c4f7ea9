package com.netcourier.intake.config;

import com.netcourier.intake.controller.ProgressWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping progressWebSocketMapping(ProgressWebSocketHandler handler) {
        return new SimpleUrlHandlerMapping(Map.of("/ocr-progress", handler), Ordered.HIGHEST_PRECEDENCE);
    }
}
