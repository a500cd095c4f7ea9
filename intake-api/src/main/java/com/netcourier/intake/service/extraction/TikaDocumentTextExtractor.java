package com.netcourier.intake.service.extraction;

import com.netcourier.intake.service.intake.IntakeException;
import com.netcourier.intake.service.intake.IntakeFailure;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

@Component
public class TikaDocumentTextExtractor implements DirectTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TikaDocumentTextExtractor.class);

    private final AutoDetectParser parser = new AutoDetectParser();

    @Override
    public String extract(Path file) {
        try (InputStream inputStream = Files.newInputStream(file)) {
            BodyContentHandler handler = new BodyContentHandler(-1);
            Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, file.getFileName().toString());
            parser.parse(inputStream, handler, metadata, new ParseContext());
            String text = Optional.ofNullable(handler.toString())
                    .map(String::trim)
                    .orElse("");
            log.debug("Extracted {} characters from {} ({})", text.length(), file.getFileName(), metadata.get(Metadata.CONTENT_TYPE));
            return text;
        } catch (Exception e) {
            log.error("Failed to extract text from document {}", file.getFileName(), e);
            throw new IntakeException(IntakeFailure.EXTERNAL_SERVICE_FAILURE, "Failed to extract document text", e);
        }
    }
}
