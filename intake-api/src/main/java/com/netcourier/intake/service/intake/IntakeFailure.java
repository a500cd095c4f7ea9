package com.netcourier.intake.service.intake;

import org.springframework.http.HttpStatus;

/**
 * Failure kinds raised along the intake pipeline, each bound to the HTTP status it surfaces as.
 */
public enum IntakeFailure {

    MALFORMED_REQUEST(HttpStatus.BAD_REQUEST),
    NO_FILE_IN_REQUEST(HttpStatus.BAD_REQUEST),
    INVALID_TYPE_REQUEST(HttpStatus.BAD_REQUEST),
    EXTERNAL_TOOL_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR),
    EXTERNAL_SERVICE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR),
    MALFORMED_MODEL_OUTPUT(HttpStatus.INTERNAL_SERVER_ERROR),
    TAXONOMY_IO_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR),
    PROCESSING_FAILED(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    IntakeFailure(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
