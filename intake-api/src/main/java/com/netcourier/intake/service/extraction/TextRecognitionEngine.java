package com.netcourier.intake.service.extraction;

import java.nio.file.Path;

/**
 * OCR engine that writes the text recognized on an image to a sidecar file.
 */
public interface TextRecognitionEngine {

    /**
     * Recognizes {@code image} and writes the text to {@code outputBase + ".txt"}.
     */
    void recognize(Path image, Path outputBase);
}
