package com.netcourier.intake.service.intake;

import com.netcourier.intake.config.IntakeProperties;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

/**
 * Writes uploaded files to the upload directory as {@code upload_<epoch millis><ext>}, adding a
 * {@code -n} suffix when the name is already taken.
 */
@Component
public class UploadStorage {

    private static final String DEFAULT_EXTENSION = ".pdf";

    private final Path directory;
    private final Clock clock;

    @Autowired
    public UploadStorage(IntakeProperties properties) {
        this(properties.uploadPath(), Clock.systemUTC());
    }

    public UploadStorage(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    public Path store(MultipartUpload upload) {
        String extension = FilenameUtils.getExtension(upload.originalFileName());
        String suffix = extension.isEmpty() ? DEFAULT_EXTENSION : "." + extension;
        String stem = "upload_" + clock.millis();
        try {
            Files.createDirectories(directory);
            Path target = directory.resolve(stem + suffix);
            for (int attempt = 1; Files.exists(target); attempt++) {
                target = directory.resolve(stem + "-" + attempt + suffix);
            }
            return Files.write(target, upload.content(), StandardOpenOption.CREATE_NEW);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store upload " + upload.originalFileName(), e);
        }
    }
}
