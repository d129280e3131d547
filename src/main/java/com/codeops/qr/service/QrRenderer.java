package com.codeops.qr.service;

import com.codeops.qr.exception.RenderFailureException;
import com.codeops.qr.model.QrRequest;

/**
 * Turns a validated request into an encoded QR document. Symbol encoding and exact
 * capacity decisions belong to the implementation.
 */
public interface QrRenderer {

    /**
     * Renders a QR code.
     *
     * @param request the validated request
     * @return the document bytes in the requested format
     * @throws RenderFailureException if the data cannot be encoded or output fails
     */
    byte[] render(QrRequest request);
}
