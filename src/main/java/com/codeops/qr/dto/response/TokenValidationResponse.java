package com.codeops.qr.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TokenValidationResponse(
        boolean valid,
        String subject,
        @JsonProperty("expires_at") long expiresAt,
        List<String> scopes
) {}
