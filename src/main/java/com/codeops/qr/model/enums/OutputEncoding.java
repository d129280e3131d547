package com.codeops.qr.model.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * How the rendered document is returned: raw bytes, or base64 inside a JSON envelope.
 */
public enum OutputEncoding {
    BINARY("binary"),
    BASE64("base64");

    private final String value;

    OutputEncoding(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<OutputEncoding> fromValue(String value) {
        return Arrays.stream(values()).filter(e -> e.value.equals(value)).findFirst();
    }
}
