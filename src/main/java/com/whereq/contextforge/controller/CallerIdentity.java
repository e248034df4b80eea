package com.whereq.contextforge.controller;

/**
 * Resolves the calling user from the request
 */
final class CallerIdentity {

    static final String USER_HEADER = "X-User-Id";
    static final String ANONYMOUS = "anonymous";

    private CallerIdentity() {
    }

    // TODO: derive the caller from the authenticated principal once the gateway forwards tokens
    static String resolve(String userHeader) {
        return userHeader == null || userHeader.isBlank() ? ANONYMOUS : userHeader.trim();
    }
}
