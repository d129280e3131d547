package com.codeops.qr.controller;

import com.codeops.qr.config.AppConstants;
import com.codeops.qr.dto.response.HealthResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * Public liveness endpoint. Requires no authentication.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX)
@Tag(name = "Health", description = "Service health check")
public class HealthController {

    private final Clock clock;
    private final String version;

    public HealthController(Clock clock,
                            @Value("${codeops.version:" + AppConstants.SERVICE_VERSION + "}") String version) {
        this.clock = clock;
        this.version = version;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", Instant.now(clock).toString(), version);
    }
}
