package com.jreinhal.querygate.service;

import com.jreinhal.querygate.model.User;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads caller identity headers into a {@link User}. Only call this after the request has been trusted.
 */
final class CallerHeaders {
    private CallerHeaders() {
    }

    static User toUser(HttpServletRequest request, String operatorId) {
        User user = User.withId(operatorId);
        user.setRole(trimToNull(request.getHeader(AuthenticationService.ROLE_HEADER)));
        user.setTenantId(trimToNull(request.getHeader(AuthenticationService.TENANT_HEADER)));
        user.setSiteIds(parseSites(request.getHeader(AuthenticationService.SITES_HEADER)));
        return user;
    }

    static Set<String> parseSites(String header) {
        Set<String> sites = new LinkedHashSet<>();
        if (header == null) {
            return sites;
        }
        for (String part : header.split(",")) {
            String site = part.trim();
            if (!site.isEmpty()) {
                sites.add(site);
            }
        }
        return sites;
    }

    static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
