package com.jreinhal.querygate.execution;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one read. On failure the record list is empty and {@code error} names the kind; store
 * messages are never carried here.
 *
 * @param total number of records returned, not a count of all matches
 */
public record ExecutionResult(List<Map<String, Object>> records, int total, ExecutionError error) {
    public ExecutionResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static ExecutionResult of(List<Map<String, Object>> records) {
        List<Map<String, Object>> copy = records == null ? List.of() : records;
        return new ExecutionResult(copy, copy.size(), null);
    }

    public static ExecutionResult failed(ExecutionError error) {
        return new ExecutionResult(List.of(), 0, error);
    }

    public boolean isFailed() {
        return this.error != null;
    }

    public boolean hasData() {
        return !this.records.isEmpty();
    }
}
