package com.kubelab.security;

/**
 * Thrown by the credential extraction stage when a protected request carries no usable
 * {@code Authorization: Bearer} header. Surfaces as 403, distinct from the 401 of
 * {@link UnauthorizedException}.
 */
public class MissingCredentialsException extends AuthenticationException {

    public static final String NOT_AUTHENTICATED = "Not authenticated";
    public static final String INVALID_SCHEME = "Invalid authentication credentials";

    public MissingCredentialsException(String message) {
        super(message);
    }
}
