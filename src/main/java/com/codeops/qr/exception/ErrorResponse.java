package com.codeops.qr.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Standard error response body returned by all exception handlers and by the
 * authentication entry point.
 *
 * @param error   the error category, see {@link ErrorKind}
 * @param message the human-readable error message
 * @param details the offending field and violated constraint, when one applies
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, ErrorDetails details) {

    /**
     * Field-level detail for validation failures.
     *
     * @param field      the request field that failed
     * @param constraint the violated constraint
     */
    public record ErrorDetails(String field, String constraint) {}

    public static ErrorResponse of(ErrorKind kind, String message) {
        return new ErrorResponse(kind.code(), message, null);
    }

    public static ErrorResponse of(ErrorKind kind, String message, String field, String constraint) {
        return new ErrorResponse(kind.code(), message, new ErrorDetails(field, constraint));
    }
}
