package com.kubelab.security;

/**
 * Public view of an authenticated user, safe to return to clients.
 *
 * @param username login username (the JWT 'sub' claim)
 * @param email    user's email address (nullable)
 */
public record AuthenticatedUser(String username, String email) {
}
