package com.github.dimitryivaniuta.governance.web;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

final class BearerTokens {
    private BearerTokens() {}

    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * Token from {@code Authorization: Bearer ...}, else from the named cookie, else null.
     * A Bearer header with an empty value yields "" so that it fails verification
     * instead of silently degrading to anonymous.
     */
    static String extract(HttpServletRequest request, String cookieName) {
        String auth = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth != null && auth.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return auth.substring(BEARER_PREFIX.length()).trim();
        }
        if (auth != null && auth.trim().equalsIgnoreCase(BEARER_PREFIX.trim())) {
            return "";
        }
        Cookie[] cookies = request.getCookies();
        if (cookies == null || cookieName == null) return null;
        for (Cookie c : cookies) {
            if (cookieName.equals(c.getName()) && c.getValue() != null && !c.getValue().isBlank()) {
                return c.getValue().trim();
            }
        }
        return null;
    }
}
