package com.netcourier.intake;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netcourier.intake.service.classification.ollama.OllamaChatClient;
import com.netcourier.intake.service.progress.ProgressBroadcaster;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.Disposable;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient(timeout = "30s")
class IntakeApplicationTest {

    @TempDir
    static Path workDir;

    @DynamicPropertySource
    static void intakeProperties(DynamicPropertyRegistry registry) {
        registry.add("intake.upload-dir", () -> workDir.resolve("uploads").toString());
        registry.add("intake.taxonomy-file", () -> workDir.resolve("types.json").toString());
        registry.add("intake.ocr.datapath", () -> workDir.resolve("no-tessdata").toString());
    }

    @LocalServerPort
    private int port;

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private ProgressBroadcaster broadcaster;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private OllamaChatClient ollamaChatClient;

    private final List<String> frames = new CopyOnWriteArrayList<>();
    private Disposable socket;

    @AfterEach
    void closeSocket() {
        if (socket != null) {
            socket.dispose();
        }
    }

    @Test
    void textUploadIsClassifiedAgainstSeededTaxonomy() throws Exception {
        when(ollamaChatClient.complete(eq("llama3"), contains("Invoice #123, total $500"), anyMap()))
                .thenReturn(chatReply("{\"type\":\"invoice\",\"summary\":\"Invoice number 123 for a total of $500.\"}"));
        connectObserver();

        webTestClient.post()
                .uri("/upload?model=llama3")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart("invoice.txt", "Invoice #123, total $500")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.type").isEqualTo("invoice")
                .jsonPath("$.summary").isEqualTo("Invoice number 123 for a total of $500.")
                .jsonPath("$.description").isEqualTo("Счёт на оплату")
                .jsonPath("$.isNewType").isEqualTo(false);

        awaitUntil(() -> frames.stream().anyMatch(frame -> frame.contains("\"step\":\"done\"")));
        List<JsonNode> events = parsedFrames();
        assertThat(events.get(0).path("step").asText()).isEqualTo("upload");
        assertThat(events.get(0).path("message").asText()).isEqualTo("Receiving file...");
        assertThat(events).allSatisfy(event -> assertThat(event.path("elapsed").isNumber()).isTrue());
        assertThat(events).extracting(event -> event.path("step").asText())
                .contains("extract", "llm", "process")
                .doesNotContain("ocr", "error");
    }

    @Test
    void scannedImageIsStillClassifiedWhenTesseractCannotRun() throws Exception {
        when(ollamaChatClient.complete(anyString(), anyString(), anyMap()))
                .thenReturn(chatReply("{\"type\":\"Photo\",\"summary\":\"An image without readable text.\"}"));
        connectObserver();

        webTestClient.post()
                .uri("/upload?model=llama3")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart("scan.png", "not really a png")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.type").isEqualTo("photo")
                .jsonPath("$.isNewType").isEqualTo(true);

        awaitUntil(() -> frames.stream().anyMatch(frame -> frame.contains("\"step\":\"done\"")));
        assertThat(parsedFrames()).extracting(event -> event.path("message").asText())
                .contains("Using Tesseract OCR for: scan.png", "Tesseract OCR failed.");
    }

    @Test
    void confirmedTypeIsOfferedToLaterUploads() {
        webTestClient.post()
                .uri("/confirm-type")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"contract\",\"description\":\"Договор\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.types[?(@.name == 'contract')].description").isEqualTo("Договор");

        webTestClient.post()
                .uri("/confirm-type")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"contract\",\"description\":\"Другое описание\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.types[?(@.name == 'contract')].description").isEqualTo("Договор");
    }

    @Test
    void requestWithoutFileIsRejected() {
        LinkedMultiValueMap<String, Object> data = new LinkedMultiValueMap<>();
        data.add("model", "llama3");

        webTestClient.post()
                .uri("/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(data))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("No file found in request");
    }

    private void connectObserver() throws InterruptedException {
        int before = broadcaster.observerCount();
        socket = new ReactorNettyWebSocketClient()
                .execute(URI.create("ws://localhost:" + port + "/ocr-progress"),
                        session -> session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .doOnNext(frames::add)
                                .then())
                .subscribe();
        awaitUntil(() -> broadcaster.observerCount() > before);
    }

    private List<JsonNode> parsedFrames() throws Exception {
        List<JsonNode> events = new ArrayList<>();
        for (String frame : frames) {
            events.add(objectMapper.readTree(frame));
        }
        return events;
    }

    private JsonNode chatReply(String content) {
        ObjectNode reply = objectMapper.createObjectNode();
        reply.put("model", "llama3");
        reply.putObject("message").put("role", "assistant").put("content", content);
        reply.put("done", true);
        return reply;
    }

    private static MultiValueMap<String, Object> multipart(String filename, String content) {
        ByteArrayResource file = new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return filename;
            }
        };
        LinkedMultiValueMap<String, Object> data = new LinkedMultiValueMap<>();
        data.add("model", "llama3");
        data.add("file", file);
        return data;
    }

    private static void awaitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 10 seconds");
            }
            Thread.sleep(20);
        }
    }
}
