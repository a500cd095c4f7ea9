package com.netcourier.intake.service.intake;

import com.netcourier.intake.config.IntakeProperties;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Keeps or deletes stored uploads and OCR scratch directories according to
 * {@code intake.retention.*}. Both are kept by default. Deletion failures are logged and do not
 * affect the request that triggered them.
 */
@Component
public class ConfigurableRetentionPolicy implements RetentionPolicy {

    private static final Logger log = LoggerFactory.getLogger(ConfigurableRetentionPolicy.class);

    private final boolean keepUploads;
    private final boolean keepScratch;

    @Autowired
    public ConfigurableRetentionPolicy(IntakeProperties properties) {
        this(properties.getRetention().isKeepUploads(), properties.getRetention().isKeepScratch());
    }

    public ConfigurableRetentionPolicy(boolean keepUploads, boolean keepScratch) {
        this.keepUploads = keepUploads;
        this.keepScratch = keepScratch;
    }

    @Override
    public void afterOcr(Path scratchDirectory) {
        if (keepScratch || scratchDirectory == null) {
            return;
        }
        try {
            FileUtils.deleteDirectory(scratchDirectory.toFile());
        } catch (IOException e) {
            log.warn("Failed to delete OCR scratch directory {}", scratchDirectory, e);
        }
    }

    @Override
    public void afterIntake(Path storedUpload) {
        if (keepUploads || storedUpload == null) {
            return;
        }
        try {
            Files.deleteIfExists(storedUpload);
        } catch (IOException e) {
            log.warn("Failed to delete stored upload {}", storedUpload, e);
        }
    }
}
