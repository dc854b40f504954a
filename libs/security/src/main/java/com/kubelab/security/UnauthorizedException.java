package com.kubelab.security;

/**
 * Thrown by {@link TokenService#verifyToken} for any token that is not accepted.
 * <p>
 * The {@link Reason} is kept for logging only. Clients always receive the same
 * {@link #DETAIL} so they cannot learn which check failed.
 */
public class UnauthorizedException extends AuthenticationException {

    public static final String DETAIL = "Could not validate credentials";

    /** Internal verification failure reason. Never exposed to clients. */
    public enum Reason {
        MALFORMED,
        INVALID_SIGNATURE,
        ALGORITHM_MISMATCH,
        EXPIRED,
        MISSING_SUBJECT,
        UNKNOWN_SUBJECT
    }

    private final Reason reason;

    public UnauthorizedException(Reason reason) {
        super(DETAIL);
        this.reason = reason;
    }

    public UnauthorizedException(Reason reason, Throwable cause) {
        super(DETAIL, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
