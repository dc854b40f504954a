package com.kubelab.security;

/**
 * A user entry in the in-memory {@link UserDirectory}.
 * <p>
 * Built once at startup and never modified. The password is only ever held as a bcrypt hash,
 * and {@link #toString()} leaves the hash out so records can be logged.
 *
 * @param username     unique login name
 * @param email        optional email address
 * @param passwordHash bcrypt hash of the user's password
 */
public record UserRecord(String username, String email, String passwordHash) {

    public UserRecord {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username must not be null or blank");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalArgumentException("passwordHash must not be null or blank");
        }
    }

    /**
     * Returns the client-facing view of this user.
     */
    public AuthenticatedUser toAuthenticatedUser() {
        return new AuthenticatedUser(username, email);
    }

    @Override
    public String toString() {
        return "UserRecord[username=" + username + ", email=" + email + "]";
    }
}
