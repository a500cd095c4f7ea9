package com.netcourier.intake.service.intake;

import com.netcourier.intake.model.ClassificationResponse;
import com.netcourier.intake.service.taxonomy.TypeEntry;
import reactor.core.publisher.Mono;

import java.util.List;

public interface IntakeService {

    /**
     * Runs one upload through parsing, text extraction, classification and reconciliation.
     * Blocks until the pipeline finishes.
     */
    ClassificationResponse intake(IntakeCommand command);

    List<TypeEntry> confirmType(String type, String description);

    Mono<List<String>> availableModels();
}
