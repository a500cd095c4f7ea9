package com.netcourier.intake.model;

import jakarta.validation.constraints.NotBlank;

public record ConfirmTypeRequest(@NotBlank String type, String description) {
}
