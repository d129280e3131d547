package com.codeops.qr.exception;

import com.codeops.qr.config.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Converts every exception raised behind the controllers into the fixed
 * {@link ErrorResponse} shape. Internal errors are logged with their cause and reported
 * to the client with a generic message only.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(AuthenticationFailedException ex) {
        log.warn("Authentication failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(ErrorResponse.of(ex.getKind(), ex.getMessage()));
    }

    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<ErrorResponse> handleCapacityExceeded(CapacityExceededException ex) {
        log.warn("Capacity exceeded: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ErrorKind.CAPACITY_EXCEEDED, sanitize(ex.getMessage()),
                        ex.getField(), ex.getConstraint()));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        log.warn("Validation failed on {} ({}): {}", ex.getField(), ex.getConstraint(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ErrorKind.VALIDATION_ERROR, sanitize(ex.getMessage()),
                        ex.getField(), ex.getConstraint()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        if (fieldError == null) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ErrorResponse.of(ErrorKind.VALIDATION_ERROR, "Invalid request"));
        }
        String message = fieldError.getField() + ": " + fieldError.getDefaultMessage();
        log.warn("Request body validation failed: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ErrorKind.VALIDATION_ERROR, sanitize(message),
                        fieldError.getField(), constraintOf(fieldError)));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ErrorKind.VALIDATION_ERROR, "Malformed request body", "body", "json"));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ErrorResponse.of(ErrorKind.FORBIDDEN, "Access denied"));
    }

    @ExceptionHandler(PayloadTooLargeException.class)
    public ResponseEntity<ErrorResponse> handlePayloadTooLarge(PayloadTooLargeException ex) {
        log.warn("Payload too large: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ErrorResponse.of(ErrorKind.PAYLOAD_TOO_LARGE, sanitize(ex.getMessage())));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException ex) {
        log.warn("Unsupported content type: {}", ex.getContentType());
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(ErrorResponse.of(ErrorKind.UNSUPPORTED_FORMAT,
                        "Unsupported content type. Expected: application/json"));
    }

    @ExceptionHandler(RenderFailureException.class)
    public ResponseEntity<ErrorResponse> handleRenderFailure(RenderFailureException ex) {
        if (ex.isCallerCaused()) {
            log.warn("QR generation rejected input: {}", ex.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(ErrorResponse.of(ErrorKind.GENERATION_ERROR, sanitize(ex.getMessage())));
        }
        log.error("QR generation failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorKind.INTERNAL_ERROR,
                        "An unexpected error occurred while processing your request"));
    }

    @ExceptionHandler(ServiceBusyException.class)
    public ResponseEntity<ErrorResponse> handleServiceBusy(ServiceBusyException ex) {
        log.warn("Service busy: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.of(ErrorKind.SERVICE_UNAVAILABLE, "Service is busy, try again later"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of(ErrorKind.NOT_FOUND, "Resource not found"));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(ErrorResponse.of(ErrorKind.METHOD_NOT_ALLOWED,
                        "Method " + ex.getMethod() + " is not supported"));
    }

    @ExceptionHandler(QrApiException.class)
    public ResponseEntity<ErrorResponse> handleQrApi(QrApiException ex) {
        log.error("Unhandled service exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorKind.INTERNAL_ERROR, "An internal error occurred"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorKind.INTERNAL_ERROR, "An internal error occurred"));
    }

    /**
     * Strips angle brackets and truncates a message before it is sent to a client.
     *
     * @param message the raw message
     * @return the sanitized message
     */
    static String sanitize(String message) {
        if (message == null) {
            return "";
        }
        String sanitized = message.replaceAll("[<>]", "");
        if (sanitized.length() > AppConstants.MAX_ERROR_MESSAGE_LENGTH) {
            sanitized = sanitized.substring(0, AppConstants.MAX_ERROR_MESSAGE_LENGTH - 3) + "...";
        }
        return sanitized;
    }

    private static String constraintOf(FieldError fieldError) {
        String code = fieldError.getCode();
        if (code == null) {
            return "invalid";
        }
        return switch (code) {
            case "NotBlank", "NotNull", "NotEmpty" -> "required";
            case "Size" -> "length";
            default -> code.toLowerCase();
        };
    }
}
