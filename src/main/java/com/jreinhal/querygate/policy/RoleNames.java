package com.jreinhal.querygate.policy;

import java.util.Locale;
import java.util.regex.Pattern;

public final class RoleNames {
    public static final String DEFAULT_ROLE = "default";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private RoleNames() {
    }

    /**
     * Lower-cases, trims and collapses internal whitespace to a single underscore,
     * so "Project  Director" and "project_director" resolve to the same policy.
     */
    public static String normalize(String role) {
        if (role == null) {
            return "";
        }
        return WHITESPACE.matcher(role.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
    }
}
