package com.codeops.qr.exception;

/**
 * Thrown when the QR rendering collaborator fails. A caller-caused failure (input that
 * cannot be encoded) maps to HTTP 422; any other failure maps to HTTP 500.
 */
public class RenderFailureException extends QrApiException {

    private final boolean callerCaused;

    private RenderFailureException(String message, Throwable cause, boolean callerCaused) {
        super(message, cause);
        this.callerCaused = callerCaused;
    }

    public static RenderFailureException callerCaused(String message, Throwable cause) {
        return new RenderFailureException(message, cause, true);
    }

    public static RenderFailureException unexpected(String message, Throwable cause) {
        return new RenderFailureException(message, cause, false);
    }

    public boolean isCallerCaused() {
        return callerCaused;
    }
}
