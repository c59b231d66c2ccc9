package com.pixperfect.assets.security;

import java.util.List;

/**
 * Routes reachable without a bearer token.
 */
public final class SecurityPaths {

    public static final List<String> PUBLIC_EXACT = List.of("/", "/signup", "/login", "/error");

    public static final String UPLOADS_PREFIX = "/uploads/";

    private SecurityPaths() {
    }

    public static boolean isPublic(String path) {
        return PUBLIC_EXACT.contains(path) || path.startsWith(UPLOADS_PREFIX);
    }
}
