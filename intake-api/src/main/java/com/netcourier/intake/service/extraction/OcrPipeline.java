package com.netcourier.intake.service.extraction;

import com.netcourier.intake.config.IntakeProperties;
import com.netcourier.intake.model.ProgressStep;
import com.netcourier.intake.service.intake.IntakeException;
import com.netcourier.intake.service.intake.IntakeFailure;
import com.netcourier.intake.service.intake.RetentionPolicy;
import com.netcourier.intake.service.progress.ProgressPublisher;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Recognizes the text of a scanned document page by page.
 * <p>
 * Each run works in its own scratch directory under the upload directory. PDFs are rasterized
 * into one image per page; any other input is copied in as the only page. A failure anywhere
 * aborts the run, publishes an {@code error} event and yields an empty text instead of an
 * exception.
 */
@Component
public class OcrPipeline {

    private static final Logger log = LoggerFactory.getLogger(OcrPipeline.class);
    private static final String SIDECAR_EXTENSION = ".txt";

    private final PageRasterizer rasterizer;
    private final TextRecognitionEngine engine;
    private final ProgressPublisher progress;
    private final RetentionPolicy retentionPolicy;
    private final Path workDirectory;

    @Autowired
    public OcrPipeline(PageRasterizer rasterizer,
                       TextRecognitionEngine engine,
                       ProgressPublisher progress,
                       RetentionPolicy retentionPolicy,
                       IntakeProperties properties) {
        this(rasterizer, engine, progress, retentionPolicy, properties.uploadPath());
    }

    public OcrPipeline(PageRasterizer rasterizer,
                       TextRecognitionEngine engine,
                       ProgressPublisher progress,
                       RetentionPolicy retentionPolicy,
                       Path workDirectory) {
        this.rasterizer = rasterizer;
        this.engine = engine;
        this.progress = progress;
        this.retentionPolicy = retentionPolicy;
        this.workDirectory = workDirectory;
    }

    public String ocr(Path file) {
        Path scratch = null;
        try {
            Files.createDirectories(workDirectory);
            scratch = Files.createTempDirectory(workDirectory, "tess_");
            List<Path> pages = preparePages(file, scratch);

            StringBuilder text = new StringBuilder();
            for (Path page : pages) {
                progress.publish(ProgressStep.OCR, "Running Tesseract OCR on " + page.getFileName() + "...");
                text.append(recognize(page)).append('\n');
            }

            progress.publish(ProgressStep.OCR, "Tesseract OCR finished extracting text.");
            log.info("OCR recognized {} characters from {} page(s) of {}", text.length(), pages.size(), file.getFileName());
            return text.toString();
        } catch (Exception | LinkageError e) {
            log.error("OCR failed for {}", file.getFileName(), e);
            progress.publish(ProgressStep.ERROR, "Tesseract OCR failed.");
            return "";
        } finally {
            if (scratch != null) {
                retentionPolicy.afterOcr(scratch);
            }
        }
    }

    private List<Path> preparePages(Path file, Path scratch) throws IOException {
        if ("pdf".equals(FilenameUtils.getExtension(file.toString()).toLowerCase(Locale.ROOT))) {
            progress.publish(ProgressStep.OCR, "Converting PDF to images...");
            List<Path> pages = rasterizer.rasterize(file, scratch).stream().sorted().toList();
            if (pages.isEmpty()) {
                throw new IntakeException(IntakeFailure.EXTERNAL_TOOL_FAILURE, "Rasterizer produced no pages for " + file.getFileName());
            }
            return pages;
        }
        Path copy = scratch.resolve(file.getFileName().toString());
        Files.copy(file, copy);
        return List.of(copy);
    }

    private String recognize(Path page) throws IOException {
        Path outputBase = page.resolveSibling(FilenameUtils.removeExtension(page.getFileName().toString()));
        engine.recognize(page, outputBase);
        Path sidecar = outputBase.resolveSibling(outputBase.getFileName() + SIDECAR_EXTENSION);
        if (!Files.exists(sidecar)) {
            throw new IntakeException(IntakeFailure.EXTERNAL_TOOL_FAILURE, "OCR output missing for " + page.getFileName());
        }
        return Files.readString(sidecar, StandardCharsets.UTF_8);
    }
}
