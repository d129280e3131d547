package com.codeops.qr.exception;

/**
 * Base exception for all CodeOps-QR service exceptions.
 * Maps to HTTP 500 Internal Server Error when not caught by a more specific handler.
 */
public class QrApiException extends RuntimeException {

    /**
     * Creates a new QrApiException with the specified message.
     *
     * @param message the detail message
     */
    public QrApiException(String message) {
        super(message);
    }

    /**
     * Creates a new QrApiException with the specified message and cause.
     *
     * @param message the detail message
     * @param cause   the root cause
     */
    public QrApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
