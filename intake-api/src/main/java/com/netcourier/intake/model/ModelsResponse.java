package com.netcourier.intake.model;

import java.util.List;

public record ModelsResponse(List<String> models) {
}
