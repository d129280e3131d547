package com.codeops.qr.exception;

/**
 * Thrown when a bearer token is well formed and correctly signed but past its expiry.
 */
public class TokenExpiredException extends AuthenticationFailedException {

    public static final String MESSAGE = "Token has expired";

    public TokenExpiredException(Throwable cause) {
        super(MESSAGE, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TOKEN_EXPIRED;
    }
}
