package com.netcourier.intake.service.progress;

import com.netcourier.intake.model.ProgressStep;

public interface ProgressPublisher {

    void publish(ProgressStep step, String message);
}
