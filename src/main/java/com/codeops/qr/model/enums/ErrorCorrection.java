package com.codeops.qr.model.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * QR error correction level. Each level carries a conservative byte ceiling for
 * UTF-8 data that stays below the byte-mode capacity of the largest symbol version.
 */
public enum ErrorCorrection {
    /** ~7% recovery. */
    L(1663),
    /** ~15% recovery. */
    M(1273),
    /** ~25% recovery. */
    Q(927),
    /** ~30% recovery. */
    H(713);

    private final int maxBytes;

    ErrorCorrection(int maxBytes) {
        this.maxBytes = maxBytes;
    }

    public String value() {
        return name();
    }

    public int maxBytes() {
        return maxBytes;
    }

    public static Optional<ErrorCorrection> fromValue(String value) {
        return Arrays.stream(values()).filter(l -> l.name().equals(value)).findFirst();
    }
}
