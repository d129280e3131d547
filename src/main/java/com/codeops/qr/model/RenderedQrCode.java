package com.codeops.qr.model;

/**
 * The output of a successful render.
 *
 * @param content          the encoded document bytes
 * @param request          the request that produced it
 * @param generationTimeMs wall time spent rendering, in milliseconds
 */
public record RenderedQrCode(byte[] content, QrRequest request, long generationTimeMs) {}
