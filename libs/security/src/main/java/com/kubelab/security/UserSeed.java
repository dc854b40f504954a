package com.kubelab.security;

/**
 * Plaintext seed entry used to build the {@link UserDirectory} at startup.
 *
 * @param username unique login name
 * @param email    optional email address
 * @param password plaintext password, hashed immediately by the directory
 */
public record UserSeed(String username, String email, String password) {

    @Override
    public String toString() {
        return "UserSeed[username=" + username + ", email=" + email + "]";
    }
}
