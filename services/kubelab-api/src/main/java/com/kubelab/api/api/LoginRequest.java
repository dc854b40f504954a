package com.kubelab.api.api;

import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /auth/login}.
 */
public record LoginRequest(@NotNull String username, @NotNull String password) {

    @Override
    public String toString() {
        return "LoginRequest[username=" + username + "]";
    }
}
