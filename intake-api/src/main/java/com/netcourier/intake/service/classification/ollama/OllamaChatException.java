package com.netcourier.intake.service.classification.ollama;

public class OllamaChatException extends RuntimeException {

    public OllamaChatException(String message) {
        super(message);
    }

    public OllamaChatException(String message, Throwable cause) {
        super(message, cause);
    }
}
