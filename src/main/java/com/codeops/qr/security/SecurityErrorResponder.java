package com.codeops.qr.security;

import com.codeops.qr.exception.AuthenticationFailedException;
import com.codeops.qr.exception.ErrorKind;
import com.codeops.qr.exception.ErrorResponse;
import com.codeops.qr.exception.MissingTokenException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Writes the standard error body for requests refused by the security filter chain:
 * 401 when no valid token was presented, 403 when the token lacks a required scope.
 */
@Component
@RequiredArgsConstructor
public class SecurityErrorResponder implements AuthenticationEntryPoint, AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        ErrorResponse body;
        if (request.getAttribute(JwtAuthFilter.AUTH_FAILURE_ATTR) instanceof AuthenticationFailedException failure) {
            body = ErrorResponse.of(failure.getKind(), failure.getMessage());
        } else {
            body = ErrorResponse.of(ErrorKind.UNAUTHORIZED, MissingTokenException.MESSAGE);
        }
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        write(response, HttpServletResponse.SC_UNAUTHORIZED, body);
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        write(response, HttpServletResponse.SC_FORBIDDEN, ErrorResponse.of(ErrorKind.FORBIDDEN, "Access denied"));
    }

    private void write(HttpServletResponse response, int status, ErrorResponse body) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
