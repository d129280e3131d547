package com.codeops.qr.security;

import com.codeops.qr.exception.AuthenticationFailedException;
import com.codeops.qr.exception.MissingTokenException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Runs the {@link BearerTokenGate} on every request and populates the security context
 * with the verified {@link Subject}. Scopes become {@code SCOPE_}-prefixed authorities.
 *
 * <p>A failed check never stops the chain here. The failure is stored on the request
 * under {@link #AUTH_FAILURE_ATTR} so the entry point can report why access was refused;
 * public endpoints proceed unaffected.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthFilter extends OncePerRequestFilter {

    public static final String AUTH_FAILURE_ATTR = JwtAuthFilter.class.getName() + ".failure";

    private final BearerTokenGate bearerTokenGate;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            Subject subject = bearerTokenGate.authenticate(request);
            var authorities = subject.scopes().stream()
                    .map(scope -> new SimpleGrantedAuthority("SCOPE_" + scope))
                    .toList();
            var authentication = new UsernamePasswordAuthenticationToken(subject, null, authorities);
            SecurityContextHolder.getContext().setAuthentication(authentication);
        } catch (MissingTokenException e) {
            request.setAttribute(AUTH_FAILURE_ATTR, e);
        } catch (AuthenticationFailedException e) {
            log.warn("Rejected bearer token for {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
            SecurityContextHolder.clearContext();
            request.setAttribute(AUTH_FAILURE_ATTR, e);
        }

        filterChain.doFilter(request, response);
    }
}
