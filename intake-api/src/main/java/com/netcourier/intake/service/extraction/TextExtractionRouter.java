package com.netcourier.intake.service.extraction;

import com.netcourier.intake.config.IntakeProperties;
import com.netcourier.intake.model.ProgressStep;
import com.netcourier.intake.service.progress.ProgressPublisher;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sends scanned formats through OCR and everything else through direct extraction, by file
 * extension alone. Failures of the chosen path propagate as they are; there is no fallback from
 * one path to the other.
 */
@Component
public class TextExtractionRouter {

    private final OcrPipeline ocrPipeline;
    private final DirectTextExtractor directExtractor;
    private final ProgressPublisher progress;
    private final Set<String> ocrExtensions;

    @Autowired
    public TextExtractionRouter(OcrPipeline ocrPipeline,
                                DirectTextExtractor directExtractor,
                                ProgressPublisher progress,
                                IntakeProperties properties) {
        this(ocrPipeline, directExtractor, progress, properties.getOcr().getExtensions());
    }

    public TextExtractionRouter(OcrPipeline ocrPipeline,
                                DirectTextExtractor directExtractor,
                                ProgressPublisher progress,
                                Collection<String> ocrExtensions) {
        this.ocrPipeline = ocrPipeline;
        this.directExtractor = directExtractor;
        this.progress = progress;
        this.ocrExtensions = ocrExtensions.stream()
                .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public String route(Path file) {
        String fileName = file.getFileName().toString();
        String extension = FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT);

        if (requiresOcr(extension)) {
            progress.publish(ProgressStep.OCR, "Using Tesseract OCR for: " + fileName);
            return ocrPipeline.ocr(file);
        }

        progress.publish(ProgressStep.EXTRACT, "Extracting text with Apache Tika (." + extension + ")...");
        String text = directExtractor.extract(file);
        progress.publish(ProgressStep.EXTRACT, "Text extracted.");
        return text;
    }

    public boolean requiresOcr(String extension) {
        return ocrExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }
}
