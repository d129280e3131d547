package com.codeops.qr.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for JWT issuance and validation, bound to the
 * {@code codeops.jwt} prefix in application properties.
 *
 * <p>The {@code secret} comes from the {@code SECRET_KEY} environment variable and
 * must be at least 32 characters long; startup fails otherwise.</p>
 *
 * @see com.codeops.qr.security.TokenService
 */
@ConfigurationProperties(prefix = "codeops.jwt")
@Getter
@Setter
public class JwtProperties {
    private String secret;
    private String issuer = AppConstants.SERVICE_NAME;
    private long ttlSeconds = AppConstants.DEFAULT_TOKEN_TTL_SECONDS;
}
