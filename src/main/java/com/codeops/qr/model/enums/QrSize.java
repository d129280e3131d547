package com.codeops.qr.model.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Rendered edge length of a QR code.
 */
public enum QrSize {
    SMALL("small", 150),
    MEDIUM("medium", 300),
    LARGE("large", 600);

    private final String value;
    private final int pixels;

    QrSize(String value, int pixels) {
        this.value = value;
        this.pixels = pixels;
    }

    public String value() {
        return value;
    }

    public int pixels() {
        return pixels;
    }

    public static Optional<QrSize> fromValue(String value) {
        return Arrays.stream(values()).filter(s -> s.value.equals(value)).findFirst();
    }
}
