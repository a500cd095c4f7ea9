package com.netcourier.intake.service.classification;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Language model endpoint whose answer is constrained to a JSON schema.
 */
public interface StructuredCompletionService {

    /**
     * @return the endpoint's raw response body; the structured payload is either the body itself
     * or a JSON string under {@code message.content}
     */
    JsonNode complete(String model, String prompt, Map<String, Object> schema);
}
