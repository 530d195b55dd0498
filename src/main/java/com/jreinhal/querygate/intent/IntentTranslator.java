package com.jreinhal.querygate.intent;

import com.jreinhal.querygate.policy.ResourceMenuEntry;
import com.jreinhal.querygate.query.QueryIntent;
import java.util.List;

/**
 * Turns a free-form question into a structured query proposal. Implementations are untrusted: whatever they
 * return is passed through the sanitizer before it can reach a store.
 */
public interface IntentTranslator {

    /**
     * @param question the caller's question, already trimmed and non-blank
     * @param menu     the resources the caller may query; nothing outside it may be offered to a model
     * @throws IntentTranslationException when no answer could be obtained
     * @throws MalformedIntentException   when the answer could not be parsed
     */
    QueryIntent translate(String question, List<ResourceMenuEntry> menu);

    /**
     * False when the translator lacks the credentials or endpoint it needs and must not be called.
     */
    default boolean isConfigured() {
        return true;
    }
}
