package com.netcourier.intake.service.intake;

public record IntakeCommand(byte[] body, String contentType, String model) {
}
