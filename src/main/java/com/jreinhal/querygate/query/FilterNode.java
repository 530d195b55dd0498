package com.jreinhal.querygate.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed read predicate. A tree of field matches combined with AND / OR; an empty AND matches everything.
 */
public sealed interface FilterNode permits FilterNode.FieldMatch, FilterNode.And, FilterNode.Or {

    /**
     * Comparison of one field path. {@code field} may be a dotted path; its top-level segment is what
     * the allowlist governs.
     */
    record FieldMatch(String field, FilterOperator operator, Object value) implements FilterNode {
        public FieldMatch {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("field is required");
            }
            if (operator == null) {
                throw new IllegalArgumentException("operator is required");
            }
            if (value instanceof List<?> list) {
                value = Collections.unmodifiableList(new ArrayList<>(list));
            }
        }
    }

    record And(List<FilterNode> children) implements FilterNode {
        public And {
            children = List.copyOf(children);
        }
    }

    record Or(List<FilterNode> children) implements FilterNode {
        public Or {
            children = List.copyOf(children);
        }
    }

    static FilterNode matchAll() {
        return new And(List.of());
    }

    /**
     * Predicate no document satisfies. Used when a required scope cannot be expressed.
     */
    static FilterNode matchNone() {
        return new FieldMatch("_id", FilterOperator.IN, List.of());
    }

    /**
     * Conjunction of the given parts with match-all parts removed; a single remaining part is returned as is.
     */
    static FilterNode allOf(FilterNode... parts) {
        List<FilterNode> kept = new ArrayList<>();
        for (FilterNode part : parts) {
            if (part != null && !part.isMatchAll()) {
                kept.add(part);
            }
        }
        if (kept.isEmpty()) {
            return matchAll();
        }
        return kept.size() == 1 ? kept.get(0) : new And(kept);
    }

    default boolean isMatchAll() {
        return this instanceof And and && and.children().isEmpty();
    }

    /**
     * Every field path referenced anywhere in the tree.
     */
    default Set<String> fieldPaths() {
        Set<String> out = new LinkedHashSet<>();
        collectFieldPaths(this, out);
        return out;
    }

    /**
     * Renders the node in the operator-keyed map shape an intent filter uses.
     */
    default Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (this instanceof FieldMatch match) {
            Map<String, Object> condition = new LinkedHashMap<>();
            if (match.value() instanceof RegexValue regex) {
                condition.put(FilterOperator.REGEX.token(), regex.pattern());
                if (regex.hasOptions()) {
                    condition.put(FilterOperator.REGEX_OPTIONS, regex.options());
                }
            } else {
                condition.put(match.operator().token(), intentValue(match.value()));
            }
            out.put(match.field(), condition);
        } else if (this instanceof And and) {
            out.put(FilterOperator.AND, and.children().stream().map(FilterNode::toMap).toList());
        } else if (this instanceof Or or) {
            out.put(FilterOperator.OR, or.children().stream().map(FilterNode::toMap).toList());
        }
        return out;
    }

    static String topLevelSegment(String path) {
        if (path == null) {
            return "";
        }
        int dot = path.indexOf('.');
        return dot < 0 ? path : path.substring(0, dot);
    }

    /**
     * Converts a typed operand back to the JSON form a translator writes: dates as ISO-8601 instants and
     * ids as their string value.
     */
    private static Object intentValue(Object value) {
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        if (value instanceof OpaqueId id) {
            return id.value();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(FilterNode::intentValue).toList();
        }
        return value;
    }

    private static void collectFieldPaths(FilterNode node, Set<String> out) {
        if (node instanceof FieldMatch match) {
            out.add(match.field());
        } else if (node instanceof And and) {
            and.children().forEach(child -> collectFieldPaths(child, out));
        } else if (node instanceof Or or) {
            or.children().forEach(child -> collectFieldPaths(child, out));
        }
    }
}
