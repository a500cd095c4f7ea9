package com.netcourier.intake.service.intake;

import com.netcourier.intake.config.IntakeProperties;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ResolvableType;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ReactiveHttpInputMessage;
import org.springframework.http.codec.multipart.DefaultPartHttpMessageReader;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Pulls the single uploaded file out of a fully buffered {@code multipart/form-data} body.
 * <p>
 * The first part whose {@code Content-Disposition} declares a {@code filename} wins; other parts
 * are ignored. File content is handed over byte for byte.
 */
@Component
public class MultipartExtractor {

    private static final Logger log = LoggerFactory.getLogger(MultipartExtractor.class);
    private static final ResolvableType PART_TYPE = ResolvableType.forClass(Part.class);
    private static final String DEFAULT_EXTENSION = ".pdf";

    private final DefaultPartHttpMessageReader reader = new DefaultPartHttpMessageReader();
    private final Clock clock;

    @Autowired
    public MultipartExtractor(IntakeProperties properties) {
        this((int) Math.min(Integer.MAX_VALUE, properties.getMultipart().getMaxInMemorySize().toBytes()), Clock.systemUTC());
    }

    public MultipartExtractor(int maxInMemorySize, Clock clock) {
        this.reader.setMaxInMemorySize(maxInMemorySize);
        this.clock = clock;
    }

    public MultipartUpload extract(byte[] body, String contentType) {
        MediaType mediaType = boundaryMediaType(contentType);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(mediaType);

        List<Part> parts;
        try {
            parts = reader.read(PART_TYPE, new BufferedInputMessage(headers, body), Map.of())
                    .collectList()
                    .block();
        } catch (RuntimeException ex) {
            log.warn("Multipart body could not be decoded: {}", ex.getMessage());
            throw new IntakeException(IntakeFailure.MALFORMED_REQUEST, "Malformed multipart body", ex);
        }

        FilePart filePart = parts == null ? null : parts.stream()
                .filter(FilePart.class::isInstance)
                .map(FilePart.class::cast)
                .findFirst()
                .orElse(null);
        if (filePart == null) {
            throw new IntakeException(IntakeFailure.NO_FILE_IN_REQUEST, "No file found in request");
        }
        return new MultipartUpload(resolveFileName(filePart.filename()), readContent(filePart));
    }

    private MediaType boundaryMediaType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            throw new IntakeException(IntakeFailure.MALFORMED_REQUEST, "Invalid Content-Type header");
        }
        MediaType mediaType;
        try {
            mediaType = MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException ex) {
            throw new IntakeException(IntakeFailure.MALFORMED_REQUEST, "Invalid Content-Type header", ex);
        }
        String boundary = mediaType.getParameter("boundary");
        if (boundary == null || boundary.isBlank()) {
            throw new IntakeException(IntakeFailure.MALFORMED_REQUEST, "Invalid Content-Type header: multipart boundary missing");
        }
        return mediaType;
    }

    private byte[] readContent(FilePart part) {
        try {
            DataBuffer joined = DataBufferUtils.join(part.content()).block();
            if (joined == null) {
                return new byte[0];
            }
            byte[] bytes = new byte[joined.readableByteCount()];
            joined.read(bytes);
            DataBufferUtils.release(joined);
            return bytes;
        } catch (RuntimeException ex) {
            throw new IntakeException(IntakeFailure.MALFORMED_REQUEST, "Failed to read uploaded file content", ex);
        }
    }

    private String resolveFileName(String declared) {
        String name = declared == null ? "" : FilenameUtils.getName(declared);
        return name.isBlank() ? "upload_" + clock.millis() + DEFAULT_EXTENSION : name;
    }

    private static final class BufferedInputMessage implements ReactiveHttpInputMessage {

        private final HttpHeaders headers;
        private final byte[] body;

        private BufferedInputMessage(HttpHeaders headers, byte[] body) {
            this.headers = headers;
            this.body = body == null ? new byte[0] : body;
        }

        @Override
        public HttpHeaders getHeaders() {
            return headers;
        }

        @Override
        public Flux<DataBuffer> getBody() {
            return Flux.defer(() -> Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(body)));
        }
    }
}
