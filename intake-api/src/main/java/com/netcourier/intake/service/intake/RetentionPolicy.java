package com.netcourier.intake.service.intake;

import java.nio.file.Path;

/**
 * Decides what happens to files the pipeline leaves behind.
 */
public interface RetentionPolicy {

    void afterOcr(Path scratchDirectory);

    void afterIntake(Path storedUpload);
}
