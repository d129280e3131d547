package com.codeops.qr.exception;

/**
 * Error categories reported in the {@code error} field of every error response.
 */
public enum ErrorKind {
    UNAUTHORIZED("unauthorized"),
    INVALID_CREDENTIALS("invalid_credentials"),
    TOKEN_EXPIRED("token_expired"),
    TOKEN_MALFORMED("token_malformed"),
    FORBIDDEN("forbidden"),
    VALIDATION_ERROR("validation_error"),
    CAPACITY_EXCEEDED("capacity_exceeded"),
    PAYLOAD_TOO_LARGE("payload_too_large"),
    UNSUPPORTED_FORMAT("unsupported_format"),
    GENERATION_ERROR("generation_error"),
    NOT_FOUND("not_found"),
    METHOD_NOT_ALLOWED("method_not_allowed"),
    SERVICE_UNAVAILABLE("service_unavailable"),
    INTERNAL_ERROR("internal_error");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    /**
     * Returns the wire value of this kind.
     *
     * @return the lowercase error code
     */
    public String code() {
        return code;
    }
}
