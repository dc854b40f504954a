package com.kubelab.security;

/**
 * Thrown by {@link CredentialService#authenticate} when the username is unknown or the
 * password does not match. The two cases are deliberately not told apart.
 */
public class InvalidCredentialsException extends AuthenticationException {

    public static final String DETAIL = "Incorrect username or password";

    public InvalidCredentialsException() {
        super(DETAIL);
    }
}
