package com.codeops.qr.model;

import com.codeops.qr.model.enums.ErrorCorrection;
import com.codeops.qr.model.enums.OutputEncoding;
import com.codeops.qr.model.enums.OutputFormat;
import com.codeops.qr.model.enums.QrSize;

/**
 * A validated QR generation request with defaults applied.
 *
 * @param data            the text to encode
 * @param size            rendered size
 * @param format          output document format
 * @param errorCorrection error correction level
 * @param encoding        response encoding
 */
public record QrRequest(
        String data,
        QrSize size,
        OutputFormat format,
        ErrorCorrection errorCorrection,
        OutputEncoding encoding
) {

    public static final QrSize DEFAULT_SIZE = QrSize.MEDIUM;
    public static final OutputFormat DEFAULT_FORMAT = OutputFormat.PNG;
    public static final ErrorCorrection DEFAULT_ERROR_CORRECTION = ErrorCorrection.M;
    public static final OutputEncoding DEFAULT_ENCODING = OutputEncoding.BINARY;

    /**
     * Creates a request for {@code data} using every default.
     *
     * @param data the text to encode
     * @return the request
     */
    public static QrRequest withDefaults(String data) {
        return new QrRequest(data, DEFAULT_SIZE, DEFAULT_FORMAT, DEFAULT_ERROR_CORRECTION, DEFAULT_ENCODING);
    }
}
