package com.jreinhal.querygate.sanitize;

/**
 * Fixed user-facing texts. None of them reveals which resource, field or permission caused a refusal.
 */
public final class Clarifications {
    public static final String NO_ACCESS = "I can only answer from allowed data. Please ask about data you have access to.";
    public static final String MALFORMED = "I couldn't parse the query. Please rephrase your question.";
    public static final String EMPTY_QUESTION = "Please ask a question about the data.";
    public static final String NO_RESOURCES = "You don't have access to any queryable data.";
    public static final String NOT_CONFIGURED = "Natural language query is not configured. Please use structured filters or contact your administrator.";
    public static final String TRANSLATION_FAILED = "I couldn't process that question. Please try rephrasing or ask something simpler.";

    private Clarifications() {
    }
}
