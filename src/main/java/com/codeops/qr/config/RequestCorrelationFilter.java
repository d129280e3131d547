package com.codeops.qr.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Assigns a correlation ID to each request, taking it from the {@code X-Correlation-ID}
 * header when the caller supplies one. The ID, request path, and method are placed in
 * MDC for the duration of the request and the ID is echoed on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    static final String CORRELATION_ID_KEY = "correlationId";
    static final String REQUEST_PATH_KEY = "requestPath";
    static final String REQUEST_METHOD_KEY = "requestMethod";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String correlationId = request.getHeader(AppConstants.CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        MDC.put(CORRELATION_ID_KEY, correlationId);
        MDC.put(REQUEST_PATH_KEY, request.getRequestURI());
        MDC.put(REQUEST_METHOD_KEY, request.getMethod());
        response.setHeader(AppConstants.CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(CORRELATION_ID_KEY);
            MDC.remove(REQUEST_PATH_KEY);
            MDC.remove(REQUEST_METHOD_KEY);
        }
    }
}
