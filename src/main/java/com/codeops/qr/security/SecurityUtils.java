package com.codeops.qr.security;

import com.codeops.qr.exception.MissingTokenException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Static access to the authenticated {@link Subject} of the current request.
 */
public final class SecurityUtils {

    private SecurityUtils() {}

    /**
     * Returns the subject placed in the security context by {@link JwtAuthFilter}.
     *
     * @return the current subject
     * @throws MissingTokenException if the request is not authenticated
     */
    public static Subject getCurrentSubject() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof Subject subject)) {
            throw new MissingTokenException("No authenticated user");
        }
        return subject;
    }
}
