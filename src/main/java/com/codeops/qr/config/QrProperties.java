package com.codeops.qr.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * QR generation limits and render pool sizing, bound to the {@code codeops.qr} prefix.
 * A {@code renderPoolSize} of zero or less means one worker per available processor.
 */
@ConfigurationProperties(prefix = "codeops.qr")
@Getter
@Setter
public class QrProperties {
    private int maxRequestBytes = AppConstants.DEFAULT_MAX_REQUEST_BYTES;
    private int renderPoolSize;
    private int renderQueueCapacity = 100;
    private long renderTimeoutMs = 5000;
}
