package com.codeops.qr.exception;

/**
 * Thrown when the raw request body exceeds the configured size limit.
 * Maps to HTTP 413 Payload Too Large.
 */
public class PayloadTooLargeException extends QrApiException {

    public PayloadTooLargeException(int maxBytes) {
        super("Request body exceeds maximum size of " + maxBytes + " bytes");
    }
}
