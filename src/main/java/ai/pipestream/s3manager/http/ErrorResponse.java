package ai.pipestream.s3manager.http;

/**
 * Error body for every non-2xx response produced by this service.
 */
public record ErrorResponse(String errorCode, String message) {
}
