package com.forgemind.dispatch.api;

/**
 * JSON error body returned by {@link ApiExceptionHandler}.
 *
 * @param error   stable error code
 * @param message human-readable detail
 */
public record ErrorResponse(String error, String message) {}
