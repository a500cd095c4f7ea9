package com.netcourier.intake.service.classification;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassificationResult(@NotBlank String type,
                                   @NotNull @Size(min = 10) String summary) {

    public ClassificationResult withNormalisedType() {
        return new ClassificationResult(type.toLowerCase(Locale.ROOT), summary);
    }
}
