package com.gprintex.commission.api;

import java.security.Principal;

/**
 * Resolves the acting user: the X-User-Id header wins, then the authenticated principal.
 */
final class RequestUser {

    static final String HEADER = "X-User-Id";
    static final String SYSTEM = "system";

    private RequestUser() {
    }

    static String resolve(String headerValue, Principal principal) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue.trim();
        }
        if (principal != null && principal.getName() != null) {
            return principal.getName();
        }
        return SYSTEM;
    }
}
