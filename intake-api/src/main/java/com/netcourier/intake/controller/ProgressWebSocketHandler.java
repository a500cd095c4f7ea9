package com.netcourier.intake.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.intake.model.ProgressEvent;
import com.netcourier.intake.service.progress.ProgressBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Pushes every progress event as a JSON text frame. Inbound frames are read only to notice the
 * client closing the connection.
 */
@Component
public class ProgressWebSocketHandler implements WebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ProgressWebSocketHandler.class);

    private final ProgressBroadcaster broadcaster;
    private final ObjectMapper objectMapper;

    public ProgressWebSocketHandler(ProgressBroadcaster broadcaster, ObjectMapper objectMapper) {
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        log.info("Progress observer {} connected", session.getId());
        Flux<WebSocketMessage> outbound = broadcaster.events()
                .map(this::toJson)
                .map(session::textMessage);
        Mono<Void> inbound = session.receive().then();
        return Mono.firstWithSignal(inbound, session.send(outbound))
                .doFinally(signal -> log.info("Progress observer {} disconnected ({})", session.getId(), signal));
    }

    private String toJson(ProgressEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize progress event {}", event.step(), e);
            return "{\"step\":\"error\"}";
        }
    }
}
