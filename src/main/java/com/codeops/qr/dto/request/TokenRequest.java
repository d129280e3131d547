package com.codeops.qr.dto.request;

import jakarta.validation.constraints.NotNull;

public record TokenRequest(
        @NotNull String username,
        @NotNull String password
) {

    @Override
    public String toString() {
        return "TokenRequest[username=" + username + ", password=****]";
    }
}
