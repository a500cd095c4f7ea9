package com.netcourier.intake.service.classification.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.netcourier.intake.service.classification.StructuredCompletionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for a local Ollama server. {@link #complete} blocks and must not be called from an event
 * loop thread.
 */
@Component
public class OllamaChatClient implements StructuredCompletionService {

    private static final Logger log = LoggerFactory.getLogger(OllamaChatClient.class);

    private final WebClient webClient;
    private final Duration timeout;

    public OllamaChatClient(@Qualifier("ollamaWebClient") WebClient webClient,
                            @Value("${intake.ollama.timeout-seconds:0}") long timeoutSeconds) {
        this.webClient = webClient;
        this.timeout = timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null;
    }

    @Override
    public JsonNode complete(String model, String prompt, Map<String, Object> schema) {
        ChatRequest request = new ChatRequest(model, false, schema, List.of(new Message("user", prompt)));
        try {
            Mono<JsonNode> response = webClient.post()
                    .uri("/api/chat")
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .onErrorMap(WebClientResponseException.class, this::logAndWrap);
            JsonNode body = timeout == null ? response.block() : response.timeout(timeout).block();
            if (body == null) {
                throw new OllamaChatException("Chat endpoint returned an empty body");
            }
            return body;
        } catch (OllamaChatException ex) {
            throw ex;
        } catch (Exception ex) {
            log.warn("Ollama chat call failed: {}", ex.getMessage(), ex);
            throw new OllamaChatException("Failed to invoke chat endpoint", ex);
        }
    }

    public Mono<List<String>> listModels() {
        return webClient.get()
                .uri("/api/tags")
                .retrieve()
                .bodyToMono(TagsResponse.class)
                .map(TagsResponse::modelNames)
                .defaultIfEmpty(List.of())
                .onErrorMap(WebClientResponseException.class, this::logAndWrap)
                .onErrorMap(ex -> ex instanceof OllamaChatException ? ex : new OllamaChatException("Failed to list models", ex));
    }

    private OllamaChatException logAndWrap(WebClientResponseException exception) {
        int status = exception.getStatusCode().value();
        log.warn("Ollama returned {}: {}", status, exception.getResponseBodyAsString());
        return new OllamaChatException("Ollama returned " + status, exception);
    }

    public record ChatRequest(String model, boolean stream, Map<String, Object> format, List<Message> messages) {
    }

    public record Message(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TagsResponse(List<ModelTag> models) {

        List<String> modelNames() {
            return models == null ? List.of() : models.stream().map(ModelTag::name).toList();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModelTag(String name) {
    }
}
