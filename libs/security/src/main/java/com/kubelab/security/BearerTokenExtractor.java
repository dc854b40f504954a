package com.kubelab.security;

import java.util.Locale;

/**
 * Extracts bearer tokens from HTTP Authorization headers on protected endpoints.
 * <p>
 * The header is split on its first whitespace into a scheme and a credentials part. The scheme
 * is compared case-insensitively with {@code Bearer}.
 */
public final class BearerTokenExtractor {

    private static final String BEARER = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extraction stage for protected endpoints. Returns the token or fails with a
     * {@link MissingCredentialsException}.
     * <ul>
     *   <li>no header, or a scheme without credentials: {@link MissingCredentialsException#NOT_AUTHENTICATED}</li>
     *   <li>credentials under any scheme other than Bearer: {@link MissingCredentialsException#INVALID_SCHEME}</li>
     * </ul>
     */
    public static String require(String authorizationHeader) {
        String[] parts = split(authorizationHeader);
        if (parts == null) {
            throw new MissingCredentialsException(MissingCredentialsException.NOT_AUTHENTICATED);
        }
        if (!BEARER.equals(parts[0].toLowerCase(Locale.ROOT))) {
            throw new MissingCredentialsException(MissingCredentialsException.INVALID_SCHEME);
        }
        return parts[1];
    }

    /** Returns {scheme, credentials}, or null when either part is missing. */
    private static String[] split(String header) {
        if (header == null) {
            return null;
        }
        String trimmed = header.strip();
        int space = indexOfWhitespace(trimmed);
        if (space < 0) {
            return null;
        }
        String scheme = trimmed.substring(0, space);
        String credentials = trimmed.substring(space + 1).strip();
        if (scheme.isEmpty() || credentials.isEmpty()) {
            return null;
        }
        return new String[] {scheme, credentials};
    }

    private static int indexOfWhitespace(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
