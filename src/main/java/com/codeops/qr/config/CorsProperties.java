package com.codeops.qr.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Allowed CORS origins, bound to the {@code codeops.cors} prefix.
 */
@ConfigurationProperties(prefix = "codeops.cors")
@Getter
@Setter
public class CorsProperties {
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
}
