package com.netcourier.intake.service.intake;

import com.netcourier.intake.config.IntakeProperties;
import com.netcourier.intake.model.ClassificationResponse;
import com.netcourier.intake.model.ProgressStep;
import com.netcourier.intake.service.classification.ClassificationResult;
import com.netcourier.intake.service.classification.DocumentClassifier;
import com.netcourier.intake.service.classification.ollama.OllamaChatClient;
import com.netcourier.intake.service.extraction.TextExtractionRouter;
import com.netcourier.intake.service.progress.ProgressPublisher;
import com.netcourier.intake.service.taxonomy.TaxonomyStore;
import com.netcourier.intake.service.taxonomy.TypeEntry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Sequences one upload: parse the multipart body, store the file, extract its text, classify it
 * and reconcile the result with the taxonomy.
 * <p>
 * A body that cannot be parsed is rejected straight away. Anything that fails after that is
 * logged, announced with an {@code error} progress event and rethrown as
 * {@link IntakeFailure#PROCESSING_FAILED}.
 */
@Service
public class DefaultIntakeService implements IntakeService {

    private static final Logger log = LoggerFactory.getLogger(DefaultIntakeService.class);

    private final MultipartExtractor multipartExtractor;
    private final UploadStorage uploadStorage;
    private final TextExtractionRouter extractionRouter;
    private final DocumentClassifier classifier;
    private final TaxonomyStore taxonomyStore;
    private final ProgressPublisher progress;
    private final RetentionPolicy retentionPolicy;
    private final OllamaChatClient ollamaChatClient;
    private final MeterRegistry meterRegistry;
    private final Counter classifiedCounter;
    private final Counter failedCounter;
    private final Counter rejectedCounter;
    private final Timer intakeTimer;
    private final String defaultModel;
    private final int maxPromptChars;

    public DefaultIntakeService(MultipartExtractor multipartExtractor,
                                UploadStorage uploadStorage,
                                TextExtractionRouter extractionRouter,
                                DocumentClassifier classifier,
                                TaxonomyStore taxonomyStore,
                                ProgressPublisher progress,
                                RetentionPolicy retentionPolicy,
                                OllamaChatClient ollamaChatClient,
                                MeterRegistry meterRegistry,
                                IntakeProperties properties) {
        this.multipartExtractor = multipartExtractor;
        this.uploadStorage = uploadStorage;
        this.extractionRouter = extractionRouter;
        this.classifier = classifier;
        this.taxonomyStore = taxonomyStore;
        this.progress = progress;
        this.retentionPolicy = retentionPolicy;
        this.ollamaChatClient = ollamaChatClient;
        this.meterRegistry = meterRegistry;
        this.classifiedCounter = meterRegistry.counter("intake.uploads", "outcome", "classified");
        this.failedCounter = meterRegistry.counter("intake.uploads", "outcome", "failed");
        this.rejectedCounter = meterRegistry.counter("intake.uploads", "outcome", "rejected");
        this.intakeTimer = meterRegistry.timer("intake.duration");
        this.defaultModel = properties.getDefaultModel();
        this.maxPromptChars = Math.max(0, properties.getMaxPromptChars());
    }

    @Override
    public ClassificationResponse intake(IntakeCommand command) {
        String model = command.model() == null || command.model().isBlank() ? defaultModel : command.model();
        progress.publish(ProgressStep.UPLOAD, "Receiving file...");

        MultipartUpload upload;
        try {
            upload = multipartExtractor.extract(command.body(), command.contentType());
        } catch (IntakeException ex) {
            rejectedCounter.increment();
            log.warn("Rejected upload: {}", ex.getMessage());
            throw ex;
        }

        UploadJob job = UploadJob.received(upload.originalFileName());
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            job = job.withStoredFilePath(uploadStorage.store(upload));
            progress.publish(ProgressStep.UPLOAD, "File saved as " + job.storedFilePath().getFileName());

            progress.publish(ProgressStep.PROCESS, "Processing started...");
            job = job.withExtractedText(truncate(extractionRouter.route(job.storedFilePath())));

            List<TypeEntry> taxonomy = taxonomyStore.findAll();
            job = job.withClassification(classifier.classify(job.extractedText(), taxonomy, model));

            progress.publish(ProgressStep.PROCESS, "Matching document type against known types...");
            ClassificationResponse response = reconcile(job.classification());

            progress.publish(ProgressStep.DONE, "Processing finished.");
            classifiedCounter.increment();
            log.info("Classified {} as '{}' (new type: {})", job.originalFileName(), response.type(), response.isNewType());
            return response;
        } catch (Exception | LinkageError ex) {
            failedCounter.increment();
            log.error("Failed to process upload {}", job.originalFileName(), ex);
            progress.publish(ProgressStep.ERROR, "Failed to process file.");
            throw new IntakeException(IntakeFailure.PROCESSING_FAILED, "Failed to process file", ex);
        } finally {
            sample.stop(intakeTimer);
            Path stored = job.storedFilePath();
            if (stored != null) {
                retentionPolicy.afterIntake(stored);
            }
        }
    }

    @Override
    public List<TypeEntry> confirmType(String type, String description) {
        if (type == null || type.isBlank()) {
            throw new IntakeException(IntakeFailure.INVALID_TYPE_REQUEST, "Type name is required");
        }
        return taxonomyStore.appendIfAbsent(new TypeEntry(type, description));
    }

    @Override
    public Mono<List<String>> availableModels() {
        return ollamaChatClient.listModels()
                .onErrorMap(ex -> new IntakeException(IntakeFailure.EXTERNAL_SERVICE_FAILURE, "Failed to fetch the model list from Ollama", ex));
    }

    String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > maxPromptChars ? text.substring(0, maxPromptChars) : text;
    }

    private ClassificationResponse reconcile(ClassificationResult result) {
        Optional<TypeEntry> known = taxonomyStore.findByName(result.type());
        return new ClassificationResponse(
                result.type(),
                result.summary(),
                known.map(TypeEntry::description).orElse(null),
                known.isEmpty()
        );
    }
}
