package com.jreinhal.querygate.query;

/**
 * Pattern operand of a {@link FilterOperator#REGEX} match. Options are limited to {@code imsx}.
 */
public record RegexValue(String pattern, String options) {
    public RegexValue {
        options = options == null ? "" : options;
    }

    public boolean hasOptions() {
        return !options.isEmpty();
    }
}
