package com.kubelab.security;

/**
 * Base class for every authentication failure. All of them are terminal for the request:
 * there is no retry and no partial trust.
 */
public abstract class AuthenticationException extends RuntimeException {

    protected AuthenticationException(String message) {
        super(message);
    }

    protected AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
