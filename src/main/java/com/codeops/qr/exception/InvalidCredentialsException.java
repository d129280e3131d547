package com.codeops.qr.exception;

/**
 * Thrown when a token is requested with an unknown username or a wrong password.
 * Both cases carry the same message so usernames cannot be enumerated.
 */
public class InvalidCredentialsException extends AuthenticationFailedException {

    public static final String MESSAGE = "Invalid username or password";

    public InvalidCredentialsException() {
        super(MESSAGE);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INVALID_CREDENTIALS;
    }
}
