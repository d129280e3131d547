package com.codeops.qr.exception;

/**
 * Thrown when the render pool cannot accept more work.
 * Maps to HTTP 503 Service Unavailable.
 */
public class ServiceBusyException extends QrApiException {

    public ServiceBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
