package com.netcourier.intake.service.intake;

import org.springframework.http.HttpStatus;

public class IntakeException extends RuntimeException {

    private final IntakeFailure failure;

    public IntakeException(IntakeFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public IntakeException(IntakeFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public IntakeFailure failure() {
        return failure;
    }

    public HttpStatus status() {
        return failure.status();
    }
}
