package com.netcourier.intake.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ClassificationResponse(String type,
                                     String summary,
                                     String description,
                                     @JsonProperty("isNewType") boolean isNewType) {
}
