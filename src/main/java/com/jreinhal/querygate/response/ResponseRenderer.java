package com.jreinhal.querygate.response;

import com.jreinhal.querygate.execution.ExecutionResult;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Deterministic templated answers. Errors and empty results produce the same text so a caller cannot tell a
 * permission or store failure from an empty match.
 */
@Component
public class ResponseRenderer {
    public static final String NO_DATA_MESSAGE = "Data not available.";
    static final int FULL_LISTING_MAX = 3;
    static final int SAMPLE_SIZE = 2;

    public RenderedResponse render(ExecutionResult result, String clarification) {
        if (clarification != null && !clarification.isBlank()) {
            return this.clarification(clarification);
        }
        return this.render(result);
    }

    public RenderedResponse render(ExecutionResult result) {
        if (result == null || result.isFailed() || !result.hasData()) {
            return this.noData();
        }
        List<Map<String, Object>> records = result.records();
        return new RenderedResponse(summarize(records, result.total()), records, result.total(), true, false);
    }

    public RenderedResponse clarification(String text) {
        return new RenderedResponse(text, List.of(), 0, false, true);
    }

    public RenderedResponse noData() {
        return new RenderedResponse(NO_DATA_MESSAGE, List.of(), 0, false, false);
    }

    static String summarize(List<Map<String, Object>> records, int total) {
        StringBuilder text = new StringBuilder("Found ").append(total).append(total == 1 ? " record." : " records.");
        if (records.size() <= FULL_LISTING_MAX) {
            text.append(' ').append(records.stream().map(RecordDescriptors::describe).collect(Collectors.joining("; ")));
        } else {
            text.append(" Sample: ")
                    .append(records.stream().limit(SAMPLE_SIZE).map(RecordDescriptors::describe).collect(Collectors.joining("; ")))
                    .append("...");
        }
        return text.toString();
    }
}
