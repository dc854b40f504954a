package com.kubelab.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Checks a username/password pair against the {@link UserDirectory}.
 */
public final class CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    private final UserDirectory directory;
    private final PasswordHasher hasher;
    private final String absentUserHash;

    public CredentialService(UserDirectory directory, PasswordHasher hasher) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        if (hasher == null) {
            throw new IllegalArgumentException("hasher must not be null");
        }
        this.directory = directory;
        this.hasher = hasher;
        this.absentUserHash = hasher.hash("absent-user-placeholder");
    }

    /**
     * Returns the matching user record when the password verifies against its stored hash.
     *
     * @throws InvalidCredentialsException if the user is unknown or the password is wrong
     */
    public UserRecord authenticate(String username, String password) {
        Optional<UserRecord> user = directory.find(username);
        if (user.isEmpty()) {
            // Unknown users pay for one bcrypt check too, so response time does not reveal them.
            hasher.matches(password, absentUserHash);
            log.debug("Login rejected: unknown user");
            throw new InvalidCredentialsException();
        }
        if (!hasher.matches(password, user.get().passwordHash())) {
            log.debug("Login rejected: password mismatch for user={}", username);
            throw new InvalidCredentialsException();
        }
        return user.get();
    }
}
