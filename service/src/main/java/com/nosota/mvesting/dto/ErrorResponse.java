package com.nosota.mvesting.dto;

import java.time.LocalDateTime;

/**
 * Error body returned by the REST layer for every rejected request.
 *
 * @param status    HTTP status code
 * @param error     Short error kind
 * @param message   Failed precondition
 * @param path      Request URI
 * @param timestamp When the error was produced
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        LocalDateTime timestamp
) {
    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(status, error, message, path, LocalDateTime.now());
    }
}
