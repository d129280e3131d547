package com.codeops.qr.dto.response;

public record HealthResponse(
        String status,
        String timestamp,
        String version
) {}
