package com.netcourier.intake.service.classification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netcourier.intake.model.ProgressStep;
import com.netcourier.intake.service.classification.ollama.OllamaChatException;
import com.netcourier.intake.service.intake.IntakeException;
import com.netcourier.intake.service.intake.IntakeFailure;
import com.netcourier.intake.service.progress.RecordingProgressPublisher;
import com.netcourier.intake.service.taxonomy.TypeEntry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LlmDocumentClassifierTest {

    private static final List<TypeEntry> TAXONOMY = List.of(
            new TypeEntry("report", "Отчёт"),
            new TypeEntry("invoice", "Счёт на оплату"));

    private static Validator validator;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StructuredCompletionService completionService;
    private RecordingProgressPublisher progress;
    private LlmDocumentClassifier classifier;

    @BeforeAll
    static void initValidator() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @BeforeEach
    void setUp() {
        completionService = mock(StructuredCompletionService.class);
        progress = new RecordingProgressPublisher();
        classifier = new LlmDocumentClassifier(completionService, objectMapper, validator, progress);
    }

    @Test
    void unwrapsChatEnvelopeAndLowercasesType() throws Exception {
        respondWith(envelope("{\"type\":\"Invoice\",\"summary\":\"Invoice #123 for consulting services.\"}"));

        ClassificationResult result = classifier.classify("Invoice #123, total $500", TAXONOMY, "llama3");

        assertThat(result.type()).isEqualTo("invoice");
        assertThat(result.summary()).isEqualTo("Invoice #123 for consulting services.");
        assertThat(progress.events()).extracting(RecordingProgressPublisher.Published::message)
                .containsExactly("Analyzing text with model llama3...", "Analysis finished.");
        assertThat(progress.steps()).containsOnly(ProgressStep.LLM);
    }

    @Test
    void acceptsBarePayloadAndIgnoresExtraFields() throws Exception {
        respondWith(objectMapper.readTree(
                "{\"type\":\"contract\",\"summary\":\"A lease agreement between two parties.\",\"confidence\":0.8}"));

        ClassificationResult result = classifier.classify("text", TAXONOMY, "mistral");

        assertThat(result).isEqualTo(new ClassificationResult("contract", "A lease agreement between two parties."));
    }

    @Test
    void rejectsSummaryShorterThanTenCharacters() {
        respondWith(envelope("{\"type\":\"report\",\"summary\":\"short\"}"));

        assertFailure(IntakeFailure.MALFORMED_MODEL_OUTPUT);
    }

    @Test
    void rejectsBlankType() {
        respondWith(envelope("{\"type\":\"  \",\"summary\":\"A perfectly fine summary.\"}"));

        assertFailure(IntakeFailure.MALFORMED_MODEL_OUTPUT);
    }

    @Test
    void rejectsMissingFields() {
        respondWith(envelope("{\"type\":\"report\"}"));

        assertFailure(IntakeFailure.MALFORMED_MODEL_OUTPUT);
    }

    @Test
    void rejectsContentThatIsNotJson() {
        respondWith(envelope("I think this is an invoice."));

        assertFailure(IntakeFailure.MALFORMED_MODEL_OUTPUT);
    }

    @Test
    void rejectsContentThatIsNotAnObject() {
        respondWith(envelope("[\"invoice\"]"));

        assertFailure(IntakeFailure.MALFORMED_MODEL_OUTPUT);
    }

    @Test
    void rejectsMissingResponse() {
        respondWith(null);

        assertFailure(IntakeFailure.MALFORMED_MODEL_OUTPUT);
    }

    @Test
    void endpointFailureIsReportedAsExternalServiceFailure() {
        when(completionService.complete(anyString(), anyString(), eq(LlmDocumentClassifier.RESPONSE_SCHEMA)))
                .thenThrow(new OllamaChatException("connection refused"));

        assertFailure(IntakeFailure.EXTERNAL_SERVICE_FAILURE);
        assertThat(progress.events()).extracting(RecordingProgressPublisher.Published::message)
                .doesNotContain("Analysis finished.");
    }

    @Test
    void promptListsKnownTypesBeforeDocumentText() {
        String prompt = classifier.buildPrompt("Quarterly numbers", TAXONOMY);

        assertThat(prompt)
                .contains("report — Отчёт\ninvoice — Счёт на оплату")
                .endsWith("Document text:\nQuarterly numbers\n");
        assertThat(prompt.indexOf("invoice")).isLessThan(prompt.indexOf("Quarterly numbers"));
    }

    @Test
    void promptToleratesMissingText() {
        assertThat(classifier.buildPrompt(null, List.of())).endsWith("Document text:\n\n");
    }

    private void respondWith(JsonNode response) {
        when(completionService.complete(anyString(), anyString(), eq(LlmDocumentClassifier.RESPONSE_SCHEMA)))
                .thenReturn(response);
    }

    private JsonNode envelope(String content) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", "llama3");
        root.putObject("message").put("role", "assistant").put("content", content);
        root.put("done", true);
        return root;
    }

    private void assertFailure(IntakeFailure expected) {
        assertThatThrownBy(() -> classifier.classify("some text", TAXONOMY, "llama3"))
                .isInstanceOfSatisfying(IntakeException.class,
                        ex -> assertThat(ex.failure()).isEqualTo(expected));
    }
}
