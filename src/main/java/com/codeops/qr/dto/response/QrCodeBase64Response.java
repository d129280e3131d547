package com.codeops.qr.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QrCodeBase64Response(
        String data,
        String format,
        String encoding,
        String size,
        @JsonProperty("error_correction") String errorCorrection
) {}
