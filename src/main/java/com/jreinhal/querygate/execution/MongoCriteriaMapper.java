package com.jreinhal.querygate.execution;

import com.jreinhal.querygate.query.FilterNode;
import com.jreinhal.querygate.query.OpaqueId;
import com.jreinhal.querygate.query.RegexValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Component;

/**
 * Maps the typed predicate tree onto Spring Data {@link Criteria}.
 *
 * <p>Opaque ids that look like MongoDB object ids match both their {@code ObjectId} and their string form,
 * since tenant and site references are stored either way across collections.</p>
 */
@Component
public class MongoCriteriaMapper {

    public Criteria toCriteria(FilterNode node) {
        if (node instanceof FilterNode.FieldMatch match) {
            return this.fieldCriteria(match);
        }
        if (node instanceof FilterNode.And and) {
            if (and.children().isEmpty()) {
                return new Criteria();
            }
            return new Criteria().andOperator(this.mapChildren(and.children()));
        }
        if (node instanceof FilterNode.Or or) {
            return new Criteria().orOperator(this.mapChildren(or.children()));
        }
        throw new IllegalArgumentException("Unsupported filter node");
    }

    private List<Criteria> mapChildren(List<FilterNode> children) {
        List<Criteria> out = new ArrayList<>(children.size());
        for (FilterNode child : children) {
            out.add(this.toCriteria(child));
        }
        return out;
    }

    private Criteria fieldCriteria(FilterNode.FieldMatch match) {
        Criteria criteria = Criteria.where(match.field());
        Object value = match.value();
        switch (match.operator()) {
            case EQ:
                if (value instanceof OpaqueId id && ObjectId.isValid(id.value())) {
                    return criteria.in(idForms(id));
                }
                return criteria.is(storeValue(value));
            case NE:
                if (value instanceof OpaqueId id && ObjectId.isValid(id.value())) {
                    return criteria.nin(idForms(id));
                }
                return criteria.ne(storeValue(value));
            case GT:
                return criteria.gt(storeValue(value));
            case GTE:
                return criteria.gte(storeValue(value));
            case LT:
                return criteria.lt(storeValue(value));
            case LTE:
                return criteria.lte(storeValue(value));
            case IN:
                return criteria.in(storeValues(value));
            case NIN:
                return criteria.nin(storeValues(value));
            case REGEX: {
                RegexValue regex = value instanceof RegexValue r ? r : new RegexValue(String.valueOf(value), "");
                return regex.hasOptions() ? criteria.regex(regex.pattern(), regex.options()) : criteria.regex(regex.pattern());
            }
            case EXISTS:
                return criteria.exists(Boolean.TRUE.equals(value));
            default:
                throw new IllegalArgumentException("Unsupported operator " + match.operator());
        }
    }

    private static List<Object> storeValues(Object value) {
        List<Object> out = new ArrayList<>();
        if (!(value instanceof Collection<?> values)) {
            return out;
        }
        for (Object element : values) {
            if (element instanceof OpaqueId id && ObjectId.isValid(id.value())) {
                out.addAll(idForms(id));
            } else {
                out.add(storeValue(element));
            }
        }
        return out;
    }

    private static Object storeValue(Object value) {
        if (value instanceof OpaqueId id) {
            return ObjectId.isValid(id.value()) ? new ObjectId(id.value()) : id.value();
        }
        return value;
    }

    private static List<Object> idForms(OpaqueId id) {
        return List.of(new ObjectId(id.value()), id.value());
    }
}
