package com.jreinhal.querygate.query;

import java.util.Optional;

/**
 * Field comparison operators a sanitized filter may use. Anything not listed here is dropped.
 */
public enum FilterOperator {
    EQ("$eq"),
    NE("$ne"),
    GT("$gt"),
    GTE("$gte"),
    LT("$lt"),
    LTE("$lte"),
    IN("$in"),
    NIN("$nin"),
    REGEX("$regex"),
    EXISTS("$exists");

    public static final String OPERATOR_PREFIX = "$";
    public static final String AND = "$and";
    public static final String OR = "$or";
    public static final String REGEX_OPTIONS = "$options";

    private final String token;

    FilterOperator(String token) {
        this.token = token;
    }

    public String token() {
        return this.token;
    }

    public static Optional<FilterOperator> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        for (FilterOperator op : values()) {
            if (op.token.equals(token)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    public static boolean isOperatorKey(String key) {
        return key != null && key.startsWith(OPERATOR_PREFIX);
    }
}
