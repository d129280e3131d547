package com.codeops.qr.security;

import java.time.Instant;

/**
 * A freshly signed access token.
 *
 * @param accessToken the compact JWT
 * @param tokenType   always {@code bearer}
 * @param expiresIn   lifetime in seconds
 * @param expiresAt   absolute expiry
 */
public record IssuedToken(String accessToken, String tokenType, long expiresIn, Instant expiresAt) {}
