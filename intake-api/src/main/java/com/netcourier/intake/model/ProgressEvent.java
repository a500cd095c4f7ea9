package com.netcourier.intake.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A progress notification pushed to live observers.
 *
 * @param step           pipeline stage that produced the event
 * @param message        human readable description of the stage
 * @param elapsedSeconds seconds since the previous event published by this process, two decimals
 */
public record ProgressEvent(ProgressStep step,
                            String message,
                            @JsonProperty("elapsed") double elapsedSeconds) {
}
