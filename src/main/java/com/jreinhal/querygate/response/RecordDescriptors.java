package com.jreinhal.querygate.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;

/**
 * One-line identifying descriptor for a record, taken from the first populated field of a fixed priority list.
 */
final class RecordDescriptors {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    static final int FALLBACK_LENGTH = 80;
    private static final int ID_SUFFIX_LENGTH = 6;

    private record Rule(String field, String prefix) {
    }

    private static final List<Rule> PRIORITY = List.of(
            new Rule("po_number", "PO "),
            new Rule("purchase_request_number", "PR "),
            new Rule("pr_number", "PR "),
            new Rule("projectName", ""),
            new Rule("site_name", ""),
            new Rule("name", ""),
            new Rule("item_name", ""),
            new Rule("vendor_name", ""),
            new Rule("DMR_No", "DMR "),
            new Rule("debitNoteNumber", "DN "),
            new Rule("companyName", ""));

    private RecordDescriptors() {
    }

    static String describe(Map<String, Object> record) {
        if (record == null) {
            return "";
        }
        for (Rule rule : PRIORITY) {
            Object value = record.get(rule.field());
            if (isPresent(value)) {
                return rule.prefix() + value;
            }
        }
        Object id = record.get("_id");
        if (isPresent(id)) {
            String text = id.toString();
            return text.length() > ID_SUFFIX_LENGTH ? text.substring(text.length() - ID_SUFFIX_LENGTH) : text;
        }
        return fallback(record);
    }

    private static boolean isPresent(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return false;
        }
        if (value instanceof Number number && number.doubleValue() == 0.0d) {
            return false;
        }
        return !(value instanceof String text) || !text.isEmpty();
    }

    private static String fallback(Map<String, Object> record) {
        String json;
        try {
            json = OBJECT_MAPPER.writeValueAsString(record);
        }
        catch (JsonProcessingException e) {
            json = String.valueOf(record);
        }
        return json.length() > FALLBACK_LENGTH ? json.substring(0, FALLBACK_LENGTH) : json;
    }
}
