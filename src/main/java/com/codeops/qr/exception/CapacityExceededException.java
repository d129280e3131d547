package com.codeops.qr.exception;

import lombok.Getter;

/**
 * Thrown when the UTF-8 encoded data is larger than the byte ceiling of the requested
 * error correction level. Maps to HTTP 400 with error kind {@code capacity_exceeded}.
 */
@Getter
public class CapacityExceededException extends ValidationException {

    public static final String CONSTRAINT = "capacity";

    private final int maxBytes;
    private final int actualBytes;

    public CapacityExceededException(String level, int maxBytes, int actualBytes) {
        super("data", CONSTRAINT, String.format(
                "Data too large for error correction level %s. Maximum: %d bytes, got: %d",
                level, maxBytes, actualBytes));
        this.maxBytes = maxBytes;
        this.actualBytes = actualBytes;
    }
}
