package com.netcourier.intake.service.progress;

import com.netcourier.intake.model.ProgressEvent;
import com.netcourier.intake.model.ProgressStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;

/**
 * Process-wide fan-out of progress events to every connected observer.
 * <p>
 * Delivery is best effort: an observer that has not requested more data when an event is
 * published misses it, events published with nobody connected are dropped, and late observers
 * get no history. The elapsed time of an event is measured from the previous publish of any
 * request, so concurrent uploads interleave their measurements.
 */
@Component
public class ProgressBroadcaster implements ProgressPublisher, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);

    private final Sinks.Many<ProgressEvent> sink = Sinks.many().multicast().directBestEffort();
    private final Clock clock;
    private long lastPublishMillis;

    public ProgressBroadcaster() {
        this(Clock.systemUTC());
    }

    public ProgressBroadcaster(Clock clock) {
        this.clock = clock;
        this.lastPublishMillis = clock.millis();
    }

    @Override
    public synchronized void publish(ProgressStep step, String message) {
        long now = clock.millis();
        double elapsed = Math.round((now - lastPublishMillis) / 10.0) / 100.0;
        lastPublishMillis = now;

        log.debug("[progress] {}: {} ({}s)", step.wireName(), message, elapsed);
        Sinks.EmitResult result = sink.tryEmitNext(new ProgressEvent(step, message, elapsed));
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Progress event {} not delivered: {}", step.wireName(), result);
        }
    }

    public Flux<ProgressEvent> events() {
        return sink.asFlux();
    }

    public int observerCount() {
        return sink.currentSubscriberCount();
    }

    @Override
    public void destroy() {
        sink.tryEmitComplete();
    }
}
