package com.netcourier.intake.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProgressStep {
    UPLOAD,
    EXTRACT,
    OCR,
    LLM,
    PROCESS,
    DONE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
