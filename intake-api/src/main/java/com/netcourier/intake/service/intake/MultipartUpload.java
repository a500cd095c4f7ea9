package com.netcourier.intake.service.intake;

/**
 * The file carried by an upload request.
 *
 * @param originalFileName file name declared by the client, or a generated one
 * @param content          the file bytes exactly as sent
 */
public record MultipartUpload(String originalFileName, byte[] content) {
}
