package com.codeops.qr.model.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Output document format with its response content type and file extension.
 */
public enum OutputFormat {
    PNG("png", "image/png", "png"),
    SVG("svg", "image/svg+xml", "svg"),
    JPEG("jpeg", "image/jpeg", "jpg"),
    PDF("pdf", "application/pdf", "pdf");

    private final String value;
    private final String contentType;
    private final String fileExtension;

    OutputFormat(String value, String contentType, String fileExtension) {
        this.value = value;
        this.contentType = contentType;
        this.fileExtension = fileExtension;
    }

    public String value() {
        return value;
    }

    public String contentType() {
        return contentType;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public static Optional<OutputFormat> fromValue(String value) {
        return Arrays.stream(values()).filter(f -> f.value.equals(value)).findFirst();
    }
}
