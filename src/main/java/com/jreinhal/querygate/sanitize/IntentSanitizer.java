package com.jreinhal.querygate.sanitize;

import com.jreinhal.querygate.catalog.FieldType;
import com.jreinhal.querygate.policy.GuardResult;
import com.jreinhal.querygate.query.FilterNode;
import com.jreinhal.querygate.query.FilterOperator;
import com.jreinhal.querygate.query.QueryIntent;
import com.jreinhal.querygate.query.RegexValue;
import com.jreinhal.querygate.query.SanitizedQuery;
import com.jreinhal.querygate.sanitize.SanitizeOutcome.Reason;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Trust boundary between translator output and the data store.
 *
 * <p>Rewrites an untrusted {@link QueryIntent} into a {@link SanitizedQuery} that references only the
 * resources, fields and operators the caller is allowed, or refuses with a clarification. Filters are
 * inspected by key shape only and never evaluated. Unrecognized pieces are dropped rather than reported,
 * and no input makes this class throw.</p>
 *
 * <p>Operands of date and id fields are converted to their stored form here: ISO-8601 strings become
 * {@link java.util.Date}s and 24-hex strings become {@link com.jreinhal.querygate.query.OpaqueId}s. A
 * condition whose operand cannot be read as the field's type is dropped.</p>
 */
@Component
public class IntentSanitizer {
    private static final Logger log = LoggerFactory.getLogger(IntentSanitizer.class);
    static final int MAX_FILTER_DEPTH = 8;
    static final int MAX_LIST_VALUES = 200;
    static final int MAX_REGEX_LENGTH = 256;
    private static final String REGEX_OPTION_CHARS = "imsx";
    private static final Object DROP = new Object();

    private final int defaultLimit;
    private final int maxLimit;

    public IntentSanitizer(@Value("${querygate.query.default-limit:100}") int defaultLimit,
                           @Value("${querygate.query.max-limit:500}") int maxLimit) {
        this.maxLimit = Math.max(1, maxLimit);
        this.defaultLimit = Math.min(this.maxLimit, Math.max(1, defaultLimit));
    }

    public SanitizeOutcome sanitize(QueryIntent intent, GuardResult guard) {
        if (intent == null || guard == null) {
            return SanitizeOutcome.clarify(Clarifications.MALFORMED, Reason.MALFORMED_INTENT);
        }
        if (intent.hasClarification()) {
            return SanitizeOutcome.clarify(intent.clarification(), Reason.TRANSLATOR_CLARIFICATION);
        }
        if (intent.isEmpty()) {
            return SanitizeOutcome.clarify(Clarifications.MALFORMED, Reason.MALFORMED_INTENT);
        }
        try {
            String resourceKey = intent.resourceKey() == null ? null : intent.resourceKey().trim().toLowerCase(Locale.ROOT);
            if (resourceKey == null || resourceKey.isEmpty() || !guard.allowsResource(resourceKey)) {
                return SanitizeOutcome.clarify(Clarifications.NO_ACCESS, Reason.ACCESS_DENIED);
            }
            FieldRules rules = new FieldRules(guard.allowedFieldsFor(resourceKey), guard.fieldTypesFor(resourceKey));
            FilterNode filter = this.sanitizeObject(intent.filter(), rules, 1);
            List<String> projection = this.sanitizeProjection(intent.projection(), rules.allowedFields());
            int limit = this.clampLimit(intent.limit());
            return SanitizeOutcome.accepted(new SanitizedQuery(resourceKey,
                    filter == null ? FilterNode.matchAll() : filter, projection, limit));
        }
        catch (RuntimeException e) {
            log.warn("Intent sanitization failed: {}", e.getClass().getSimpleName());
            return SanitizeOutcome.clarify(Clarifications.MALFORMED, Reason.MALFORMED_INTENT);
        }
    }

    /**
     * Converts one operator-keyed object into a node. Returns null when nothing survives.
     */
    private FilterNode sanitizeObject(Object raw, FieldRules rules, int depth) {
        if (!(raw instanceof Map<?, ?> map) || depth > MAX_FILTER_DEPTH) {
            return null;
        }
        List<FilterNode> parts = new ArrayList<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                continue;
            }
            if (FilterOperator.AND.equals(key) || FilterOperator.OR.equals(key)) {
                FilterNode logical = this.sanitizeLogical(key, entry.getValue(), rules, depth);
                if (logical != null) {
                    parts.add(logical);
                }
            } else if (!FilterOperator.isOperatorKey(key) && this.isAllowedPath(key, rules.allowedFields())) {
                FilterNode condition = this.sanitizeCondition(key, entry.getValue(), rules.typeOf(key), depth);
                if (condition != null) {
                    parts.add(condition);
                }
            }
            // Remaining operator keys ($where, $expr, $nor, ...) are dropped.
        }
        return combine(parts);
    }

    private FilterNode sanitizeLogical(String operator, Object value, FieldRules rules, int depth) {
        if (!(value instanceof List<?> items)) {
            return null;
        }
        List<FilterNode> children = new ArrayList<>();
        for (Object item : items) {
            FilterNode child = this.sanitizeObject(item, rules, depth + 1);
            if (child != null && !child.isMatchAll()) {
                children.add(child);
            }
        }
        if (children.isEmpty()) {
            return null;
        }
        return FilterOperator.AND.equals(operator) ? new FilterNode.And(children) : new FilterNode.Or(children);
    }

    private FilterNode sanitizeCondition(String field, Object value, FieldType type, int depth) {
        if (isScalar(value)) {
            Object operand = typed(value, type);
            return operand == DROP ? null : new FilterNode.FieldMatch(field, FilterOperator.EQ, operand);
        }
        if (!(value instanceof Map<?, ?> operators) || depth + 1 > MAX_FILTER_DEPTH) {
            return null;
        }
        List<FilterNode> parts = new ArrayList<>();
        for (Map.Entry<?, ?> entry : operators.entrySet()) {
            if (!(entry.getKey() instanceof String token) || FilterOperator.REGEX_OPTIONS.equals(token)) {
                continue;
            }
            Optional<FilterOperator> operator = FilterOperator.fromToken(token);
            if (operator.isEmpty()) {
                continue;
            }
            Object operand = this.sanitizeOperand(operator.get(), entry.getValue(), operators.get(FilterOperator.REGEX_OPTIONS), type);
            if (operand != DROP) {
                parts.add(new FilterNode.FieldMatch(field, operator.get(), operand));
            }
        }
        return combine(parts);
    }

    /**
     * Returns the operand to keep, or {@link #DROP} when the operator must be discarded.
     */
    private Object sanitizeOperand(FilterOperator operator, Object value, Object regexOptions, FieldType type) {
        switch (operator) {
            case IN:
            case NIN: {
                if (!(value instanceof List<?> values)) {
                    return DROP;
                }
                List<Object> kept = new ArrayList<>();
                for (Object element : values) {
                    if (kept.size() >= MAX_LIST_VALUES) {
                        break;
                    }
                    Object typedElement = isScalar(element) ? typed(element, type) : DROP;
                    if (typedElement != DROP) {
                        kept.add(typedElement);
                    }
                }
                return kept;
            }
            case EXISTS:
                return value instanceof Boolean ? value : DROP;
            case REGEX: {
                // Dates and ObjectIds are not strings in the store.
                if (type != null || !(value instanceof String pattern) || pattern.length() > MAX_REGEX_LENGTH) {
                    return DROP;
                }
                return new RegexValue(pattern, regexOptions instanceof String options ? filterRegexOptions(options) : "");
            }
            default:
                return isScalar(value) ? typed(value, type) : DROP;
        }
    }

    /**
     * Converts a scalar operand to the stored form of a typed field. Null stays null.
     */
    private static Object typed(Object value, FieldType type) {
        if (type == null || value == null) {
            return value;
        }
        if (!(value instanceof String text)) {
            return DROP;
        }
        Object converted;
        switch (type) {
            case DATE:
                converted = TypedValues.parseDate(text);
                break;
            case OBJECT_ID:
                converted = TypedValues.parseObjectId(text);
                break;
            default:
                converted = text;
        }
        return converted == null ? DROP : converted;
    }

    private List<String> sanitizeProjection(Map<String, Object> projection, Set<String> allowedFields) {
        if (projection == null || projection.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<String> kept = new LinkedHashSet<>();
        for (Map.Entry<String, Object> entry : projection.entrySet()) {
            String path = entry.getKey();
            if (this.isAllowedPath(path, allowedFields) && isIncludeMarker(entry.getValue())) {
                kept.add(path);
            }
        }
        List<String> out = new ArrayList<>();
        for (String path : kept) {
            // A path under another projected path collides in the store.
            boolean shadowed = kept.stream().anyMatch(other -> !other.equals(path) && path.startsWith(other + "."));
            if (!shadowed) {
                out.add(path);
            }
        }
        return out;
    }

    int clampLimit(Object requested) {
        long limit = this.defaultLimit;
        if (requested instanceof Number number) {
            double value = number.doubleValue();
            if (!Double.isNaN(value) && !Double.isInfinite(value)) {
                limit = (long) Math.floor(value);
            }
        }
        return (int) Math.max(1L, Math.min(this.maxLimit, limit));
    }

    private boolean isAllowedPath(String path, Set<String> allowedFields) {
        if (path == null || path.isBlank() || path.indexOf('\0') >= 0) {
            return false;
        }
        for (String segment : path.split("\\.", -1)) {
            if (segment.isEmpty() || segment.startsWith(FilterOperator.OPERATOR_PREFIX)) {
                return false;
            }
        }
        return allowedFields.contains(FilterNode.topLevelSegment(path));
    }

    private record FieldRules(Set<String> allowedFields, Map<String, FieldType> fieldTypes) {
        FieldType typeOf(String path) {
            return this.fieldTypes.get(path);
        }
    }

    private static FilterNode combine(List<FilterNode> parts) {
        if (parts.isEmpty()) {
            return null;
        }
        return parts.size() == 1 ? parts.get(0) : new FilterNode.And(parts);
    }

    private static boolean isScalar(Object value) {
        if (value instanceof Double d) {
            return !d.isNaN() && !d.isInfinite();
        }
        if (value instanceof Float f) {
            return !f.isNaN() && !f.isInfinite();
        }
        return value == null || value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static boolean isIncludeMarker(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value instanceof Number number && number.doubleValue() == 1.0d;
    }

    private static String filterRegexOptions(String options) {
        StringBuilder out = new StringBuilder();
        for (char c : options.toCharArray()) {
            if (REGEX_OPTION_CHARS.indexOf(c) >= 0 && out.indexOf(String.valueOf(c)) < 0) {
                out.append(c);
            }
        }
        return out.toString();
    }
}
