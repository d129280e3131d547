package com.codeops.qr.security;

import com.codeops.qr.exception.MissingTokenException;
import com.codeops.qr.exception.TokenMalformedException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Authenticates a request from its {@code Authorization: Bearer} header.
 * Either returns the verified {@link Subject} or throws the matching authentication failure.
 */
@Component
@RequiredArgsConstructor
public class BearerTokenGate {

    static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;

    /**
     * Extracts and verifies the bearer token of a request.
     *
     * @param request the incoming request
     * @return the authenticated subject
     * @throws MissingTokenException   if there is no Authorization header
     * @throws TokenMalformedException if the header is not a bearer token or the token is invalid
     * @throws com.codeops.qr.exception.TokenExpiredException if the token has expired
     */
    public Subject authenticate(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.isBlank()) {
            throw new MissingTokenException();
        }
        if (!header.startsWith(BEARER_PREFIX)) {
            throw new TokenMalformedException();
        }
        return tokenService.verify(header.substring(BEARER_PREFIX.length()).trim());
    }
}
