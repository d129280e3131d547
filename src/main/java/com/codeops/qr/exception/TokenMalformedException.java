package com.codeops.qr.exception;

/**
 * Thrown when a bearer token cannot be parsed, its signature does not verify,
 * or its claims are incomplete.
 */
public class TokenMalformedException extends AuthenticationFailedException {

    public static final String MESSAGE = "Invalid authentication token";

    public TokenMalformedException() {
        super(MESSAGE);
    }

    public TokenMalformedException(Throwable cause) {
        super(MESSAGE, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TOKEN_MALFORMED;
    }
}
