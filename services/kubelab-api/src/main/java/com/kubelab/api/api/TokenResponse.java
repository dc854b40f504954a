package com.kubelab.api.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body returned by a successful login.
 *
 * @param accessToken signed bearer token
 * @param tokenType always {@code bearer}
 */
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType) {

    public static TokenResponse bearer(String accessToken) {
        return new TokenResponse(accessToken, "bearer");
    }
}
