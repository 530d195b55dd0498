package com.jreinhal.querygate.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.querygate.query.QueryIntent;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Reads a translator reply into an untrusted {@link QueryIntent}. No validation beyond JSON shape happens here.
 */
@Component
public class IntentParser {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    public QueryIntent parse(String reply) {
        String json = extractObject(reply);
        if (json == null) {
            throw new MalformedIntentException("Translator reply contains no JSON object");
        }
        Map<String, Object> root;
        try {
            root = OBJECT_MAPPER.readValue(json, OBJECT_TYPE);
        }
        catch (JsonProcessingException e) {
            throw new MalformedIntentException("Translator reply is not valid JSON", e);
        }
        if (root == null) {
            throw new MalformedIntentException("Translator reply is empty");
        }
        if (root.get("clarification") instanceof String clarification && !clarification.isBlank()) {
            return QueryIntent.clarify(clarification.trim());
        }
        Object key = root.containsKey("collectionKey") ? root.get("collectionKey") : root.get("resourceKey");
        return new QueryIntent(key instanceof String text ? text : null,
                asObject(root.get("filter")),
                asObject(root.get("projection")),
                root.get("limit"),
                null);
    }

    /**
     * Span from the first '{' to the last '}', which drops code fences and surrounding chatter.
     */
    static String extractObject(String reply) {
        if (reply == null) {
            return null;
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return reply.substring(start, end + 1);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }
}
