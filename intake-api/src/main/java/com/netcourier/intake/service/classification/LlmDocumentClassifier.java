package com.netcourier.intake.service.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.intake.model.ProgressStep;
import com.netcourier.intake.service.classification.ollama.OllamaChatException;
import com.netcourier.intake.service.intake.IntakeException;
import com.netcourier.intake.service.intake.IntakeFailure;
import com.netcourier.intake.service.progress.ProgressPublisher;
import com.netcourier.intake.service.taxonomy.TypeEntry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class LlmDocumentClassifier implements DocumentClassifier {

    private static final Logger log = LoggerFactory.getLogger(LlmDocumentClassifier.class);

    static final Map<String, Object> RESPONSE_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "type", Map.of("type", "string", "minLength", 1),
                    "summary", Map.of("type", "string", "minLength", 10)
            ),
            "required", List.of("type", "summary")
    );

    private final StructuredCompletionService completionService;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final ProgressPublisher progress;

    public LlmDocumentClassifier(StructuredCompletionService completionService,
                                 ObjectMapper objectMapper,
                                 Validator validator,
                                 ProgressPublisher progress) {
        this.completionService = completionService;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.progress = progress;
    }

    @Override
    public ClassificationResult classify(String text, List<TypeEntry> taxonomy, String model) {
        String prompt = buildPrompt(text, taxonomy);

        progress.publish(ProgressStep.LLM, "Analyzing text with model " + model + "...");
        JsonNode response;
        try {
            response = completionService.complete(model, prompt, RESPONSE_SCHEMA);
        } catch (OllamaChatException ex) {
            throw new IntakeException(IntakeFailure.EXTERNAL_SERVICE_FAILURE, "Model endpoint call failed", ex);
        }
        progress.publish(ProgressStep.LLM, "Analysis finished.");

        ClassificationResult result = parse(response);
        validate(result);
        return result.withNormalisedType();
    }

    String buildPrompt(String text, List<TypeEntry> taxonomy) {
        String types = taxonomy.stream()
                .map(entry -> entry.name() + " — " + entry.description())
                .collect(Collectors.joining("\n"));
        return "Known document types:\n" + types + "\n\n"
                + "Pick the matching type name (a single word). If none fits, propose a new single-word type.\n"
                + "Write a short summary of the document (one paragraph).\n\n"
                + "Document text:\n" + (text == null ? "" : text) + "\n";
    }

    private ClassificationResult parse(JsonNode response) {
        if (response == null) {
            throw new IntakeException(IntakeFailure.MALFORMED_MODEL_OUTPUT, "Model returned no output");
        }
        try {
            JsonNode payload = response;
            JsonNode content = response.path("message").path("content");
            if (content.isTextual()) {
                payload = objectMapper.readTree(content.asText());
            }
            if (!payload.isObject()) {
                throw new IntakeException(IntakeFailure.MALFORMED_MODEL_OUTPUT, "Model did not return a JSON object");
            }
            return objectMapper.treeToValue(payload, ClassificationResult.class);
        } catch (JsonProcessingException ex) {
            log.warn("Model output could not be parsed: {}", ex.getOriginalMessage());
            throw new IntakeException(IntakeFailure.MALFORMED_MODEL_OUTPUT, "Model output is not valid JSON", ex);
        }
    }

    private void validate(ClassificationResult result) {
        Set<ConstraintViolation<ClassificationResult>> violations = validator.validate(result);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            log.warn("Model output violates the response schema: {}", detail);
            throw new IntakeException(IntakeFailure.MALFORMED_MODEL_OUTPUT, "Model output violates the response schema: " + detail);
        }
    }
}
