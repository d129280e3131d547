package com.codeops.qr.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Logs every handled request on entry and its status and duration on completion.
 * The correlation ID is already in MDC, so each line can be traced.
 */
@Component
@Slf4j
public class LoggingInterceptor implements HandlerInterceptor {

    static final String START_TIME_ATTR = LoggingInterceptor.class.getName() + ".startTime";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTR, System.currentTimeMillis());
        log.info("Request: {} {} - Client: {}", request.getMethod(), request.getRequestURI(),
                request.getRemoteAddr() != null ? request.getRemoteAddr() : "unknown");
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Object start = request.getAttribute(START_TIME_ATTR);
        long duration = start instanceof Long startMillis ? System.currentTimeMillis() - startMillis : -1;
        log.info("Response: {} {} -> {} in {}ms", request.getMethod(), request.getRequestURI(),
                response.getStatus(), duration);
    }
}
