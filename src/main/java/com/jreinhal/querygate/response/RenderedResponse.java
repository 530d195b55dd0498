package com.jreinhal.querygate.response;

import java.util.List;
import java.util.Map;

/**
 * What the caller receives. {@code clarification} is true only when the text asks the caller to rephrase and
 * no store access happened.
 */
public record RenderedResponse(String text, List<Map<String, Object>> data, int total, boolean hasData, boolean clarification) {
    public RenderedResponse {
        data = data == null ? List.of() : List.copyOf(data);
    }
}
