package com.codeops.qr.exception;

import lombok.Getter;

/**
 * Thrown when a request fails validation. Carries the first offending field and the
 * constraint it violated.
 * Maps to HTTP 400 Bad Request.
 */
@Getter
public class ValidationException extends QrApiException {

    private final String field;
    private final String constraint;

    /**
     * Creates a new ValidationException.
     *
     * @param field      the request field that failed
     * @param constraint the violated constraint, e.g. {@code max_length}
     * @param message    the detail message
     */
    public ValidationException(String field, String constraint, String message) {
        super(message);
        this.field = field;
        this.constraint = constraint;
    }
}
