package com.codeops.qr.config;

/**
 * Application-wide constants for the CodeOps-QR service.
 * Centralizes API paths, token defaults, QR request limits, and service metadata.
 */
public final class AppConstants {

    private AppConstants() {}

    /** Base path prefix for all QR API endpoints. */
    public static final String API_PREFIX = "/v1";

    /** Service name used in structured logging. */
    public static final String SERVICE_NAME = "codeops-qr";

    /** Service version reported by the health endpoint when none is configured. */
    public static final String SERVICE_VERSION = "1.0.0";

    /** Token type reported to clients on issuance. */
    public static final String TOKEN_TYPE = "bearer";

    /** Default access token lifetime in seconds (30 minutes). */
    public static final long DEFAULT_TOKEN_TTL_SECONDS = 1800;

    /** Minimum length of the HS256 signing secret. */
    public static final int MIN_SECRET_LENGTH = 32;

    /** Scope granted to every issued token and required for QR generation. */
    public static final String SCOPE_QR_GENERATE = "qr:generate";

    /** Maximum number of characters accepted in the {@code data} field. */
    public static final int MAX_DATA_LENGTH = 2000;

    /** Default maximum raw request body size in bytes (16 KB). */
    public static final int DEFAULT_MAX_REQUEST_BYTES = 16 * 1024;

    /** Quiet zone around the symbol, in modules. */
    public static final int QR_MARGIN_MODULES = 4;

    /** Smallest raster module edge, in pixels, that scanners read reliably. */
    public static final int MIN_PIXELS_PER_MODULE = 2;

    /** JPEG compression quality for raster output. */
    public static final float JPEG_QUALITY = 0.85f;

    /** Maximum length of a client-facing error message. */
    public static final int MAX_ERROR_MESSAGE_LENGTH = 200;

    /** Request and response header carrying the correlation ID. */
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
}
