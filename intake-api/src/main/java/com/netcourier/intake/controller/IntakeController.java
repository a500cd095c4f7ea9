package com.netcourier.intake.controller;

import com.netcourier.intake.model.ClassificationResponse;
import com.netcourier.intake.model.ConfirmTypeRequest;
import com.netcourier.intake.model.ConfirmTypeResponse;
import com.netcourier.intake.model.ModelsResponse;
import com.netcourier.intake.service.intake.IntakeCommand;
import com.netcourier.intake.service.intake.IntakeService;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@Validated
public class IntakeController {

    private final IntakeService intakeService;

    public IntakeController(IntakeService intakeService) {
        this.intakeService = intakeService;
    }

    @GetMapping(value = "/models", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ModelsResponse> models() {
        return intakeService.availableModels().map(ModelsResponse::new);
    }

    /**
     * Accepts the raw multipart body; parsing happens in the intake pipeline so that malformed
     * bodies are reported with the pipeline's own errors.
     */
    @PostMapping(value = "/upload", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ClassificationResponse> upload(@RequestParam(value = "model", required = false) String model,
                                               @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
                                               @RequestBody(required = false) byte[] body) {
        return Mono.fromCallable(() -> intakeService.intake(new IntakeCommand(body, contentType, model)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping(value = "/confirm-type", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ConfirmTypeResponse> confirmType(@Valid @RequestBody ConfirmTypeRequest request) {
        return Mono.fromCallable(() -> intakeService.confirmType(request.type(), request.description()))
                .map(ConfirmTypeResponse::succeeded)
                .subscribeOn(Schedulers.boundedElastic());
    }
}
