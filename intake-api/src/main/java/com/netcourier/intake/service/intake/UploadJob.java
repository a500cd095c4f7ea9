package com.netcourier.intake.service.intake;

import com.netcourier.intake.service.classification.ClassificationResult;

import java.nio.file.Path;

/**
 * State of one upload while it moves through the pipeline. Never shared between requests.
 */
public record UploadJob(String originalFileName,
                        Path storedFilePath,
                        String extractedText,
                        ClassificationResult classification) {

    public static UploadJob received(String originalFileName) {
        return new UploadJob(originalFileName, null, null, null);
    }

    public UploadJob withStoredFilePath(Path value) {
        return new UploadJob(originalFileName, value, extractedText, classification);
    }

    public UploadJob withExtractedText(String value) {
        return new UploadJob(originalFileName, storedFilePath, value, classification);
    }

    public UploadJob withClassification(ClassificationResult value) {
        return new UploadJob(originalFileName, storedFilePath, extractedText, value);
    }
}
