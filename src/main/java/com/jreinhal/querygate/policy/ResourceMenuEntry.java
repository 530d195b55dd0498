package com.jreinhal.querygate.policy;

import com.jreinhal.querygate.catalog.FieldType;
import java.util.List;
import java.util.Map;

/**
 * One line of the resource menu offered to the intent translator.
 */
public record ResourceMenuEntry(String key, String description, List<String> fields, Map<String, FieldType> fieldTypes) {
    public ResourceMenuEntry {
        fields = List.copyOf(fields);
        fieldTypes = fieldTypes == null ? Map.of() : Map.copyOf(fieldTypes);
    }

    public ResourceMenuEntry(String key, String description, List<String> fields) {
        this(key, description, fields, Map.of());
    }
}
