package com.netcourier.intake.service.classification;

import com.netcourier.intake.service.taxonomy.TypeEntry;

import java.util.List;

public interface DocumentClassifier {

    /**
     * Picks a type for the document from {@code taxonomy} or proposes a new one, and summarises it.
     *
     * @param text     extracted document text, already truncated by the caller
     * @param taxonomy known document types offered to the model
     * @param model    name of the model to run
     */
    ClassificationResult classify(String text, List<TypeEntry> taxonomy, String model);
}
