package com.jreinhal.querygate.execution;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

/**
 * {@link ResourceStore} over MongoDB. Issues plain {@code find} calls only, with field includes, a limit and
 * a server-side time budget.
 */
@Component
public class MongoResourceStore implements ResourceStore {
    private final MongoTemplate mongoTemplate;
    private final MongoCriteriaMapper criteriaMapper;

    public MongoResourceStore(MongoTemplate mongoTemplate, MongoCriteriaMapper criteriaMapper) {
        this.mongoTemplate = mongoTemplate;
        this.criteriaMapper = criteriaMapper;
    }

    @Override
    public List<Map<String, Object>> find(StoreQuery storeQuery) {
        Query query = this.buildQuery(storeQuery);
        List<Document> documents = this.mongoTemplate.find(query, Document.class, storeQuery.storeId());
        List<Map<String, Object>> records = new ArrayList<>(documents.size());
        for (Document document : documents) {
            records.add(toRecord(document));
        }
        return records;
    }

    Query buildQuery(StoreQuery storeQuery) {
        Query query = storeQuery.predicate().isMatchAll()
                ? new Query()
                : new Query(this.criteriaMapper.toCriteria(storeQuery.predicate()));
        if (!storeQuery.fields().isEmpty()) {
            query.fields().include(storeQuery.fields().toArray(new String[0]));
        }
        query.limit(storeQuery.limit());
        if (storeQuery.timeout() != null && !storeQuery.timeout().isZero()) {
            query.maxTime(storeQuery.timeout());
        }
        return query;
    }

    static Map<String, Object> toRecord(Map<String, Object> document) {
        Map<String, Object> record = new LinkedHashMap<>();
        document.forEach((key, value) -> record.put(key, plainValue(value)));
        return record;
    }

    @SuppressWarnings("unchecked")
    private static Object plainValue(Object value) {
        if (value instanceof ObjectId id) {
            return id.toHexString();
        }
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        if (value instanceof Map<?, ?> nested) {
            return toRecord((Map<String, Object>) nested);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object element : list) {
                out.add(plainValue(element));
            }
            return out;
        }
        return value;
    }
}
