package com.kubelab.security;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable in-memory user directory keyed by username.
 * <p>
 * Built once from a seed list and read-only afterwards, so lookups need no locking. There is
 * no way to add or remove users at runtime.
 */
public final class UserDirectory {

    private final Map<String, UserRecord> users;

    private UserDirectory(Map<String, UserRecord> users) {
        this.users = Map.copyOf(users);
    }

    /**
     * Builds a directory from plaintext seeds, hashing each password with a fresh salt.
     *
     * @throws IllegalArgumentException if two seeds share a username
     */
    public static UserDirectory seed(PasswordHasher hasher, List<UserSeed> seeds) {
        Map<String, UserRecord> users = new LinkedHashMap<>();
        for (UserSeed seed : seeds) {
            var record = new UserRecord(seed.username(), seed.email(), hasher.hash(seed.password()));
            if (users.putIfAbsent(record.username(), record) != null) {
                throw new IllegalArgumentException("duplicate username: " + record.username());
            }
        }
        return new UserDirectory(users);
    }

    /**
     * Builds a directory from already hashed records.
     */
    static UserDirectory of(UserRecord... records) {
        Map<String, UserRecord> users = new LinkedHashMap<>();
        for (UserRecord record : records) {
            if (users.putIfAbsent(record.username(), record) != null) {
                throw new IllegalArgumentException("duplicate username: " + record.username());
            }
        }
        return new UserDirectory(users);
    }

    /**
     * Looks up a user by exact username.
     */
    public Optional<UserRecord> find(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(users.get(username));
    }

    public int size() {
        return users.size();
    }
}
