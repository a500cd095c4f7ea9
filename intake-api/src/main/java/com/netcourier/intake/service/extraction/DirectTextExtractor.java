package com.netcourier.intake.service.extraction;

import java.nio.file.Path;

/**
 * Extracts the text layer of office and other text-bearing documents without OCR.
 */
public interface DirectTextExtractor {

    String extract(Path file);
}
