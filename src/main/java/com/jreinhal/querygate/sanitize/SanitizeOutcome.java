package com.jreinhal.querygate.sanitize;

import com.jreinhal.querygate.query.SanitizedQuery;

/**
 * Either a query that may be executed or a clarification to return instead. Never both.
 */
public record SanitizeOutcome(SanitizedQuery query, String clarification, Reason reason) {

    public enum Reason {
        ACCEPTED,
        TRANSLATOR_CLARIFICATION,
        ACCESS_DENIED,
        MALFORMED_INTENT
    }

    public static SanitizeOutcome accepted(SanitizedQuery query) {
        return new SanitizeOutcome(query, null, Reason.ACCEPTED);
    }

    public static SanitizeOutcome clarify(String clarification, Reason reason) {
        return new SanitizeOutcome(null, clarification, reason);
    }

    public boolean isClarification() {
        return this.query == null;
    }
}
