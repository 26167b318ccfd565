package com.tierstore.store.http;

import okhttp3.Request;

/**
 * Adds backend-specific authentication to an outgoing request.
 */
@FunctionalInterface
public interface RequestAuthenticator {

    void authenticate(Request.Builder request, String path, byte[] body);

    static RequestAuthenticator none() {
        return (request, path, body) -> {
        };
    }

    static RequestAuthenticator bearer(String token) {
        if (token == null || token.isBlank()) {
            return none();
        }
        return (request, path, body) -> request.header("Authorization", "Bearer " + token);
    }
}
