package com.codeops.qr.security;

import java.time.Instant;
import java.util.List;

/**
 * The authenticated caller extracted from a verified token.
 *
 * @param username  the token subject
 * @param issuedAt  the token issue time
 * @param expiresAt the token expiry time
 * @param scopes    the granted scopes
 */
public record Subject(String username, Instant issuedAt, Instant expiresAt, List<String> scopes) {

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }
}
