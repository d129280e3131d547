package com.codeops.qr.exception;

/**
 * Base for failures to authenticate a caller, whether by credentials or by token.
 * Maps to HTTP 401 Unauthorized.
 */
public abstract class AuthenticationFailedException extends QrApiException {

    protected AuthenticationFailedException(String message) {
        super(message);
    }

    protected AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the error category reported to the client.
     *
     * @return the error kind
     */
    public abstract ErrorKind getKind();
}
