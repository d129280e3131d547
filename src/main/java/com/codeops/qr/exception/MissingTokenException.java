package com.codeops.qr.exception;

/**
 * Thrown when a protected endpoint is called without a bearer token.
 */
public class MissingTokenException extends AuthenticationFailedException {

    public static final String MESSAGE = "Missing authentication token";

    public MissingTokenException() {
        super(MESSAGE);
    }

    public MissingTokenException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.UNAUTHORIZED;
    }
}
