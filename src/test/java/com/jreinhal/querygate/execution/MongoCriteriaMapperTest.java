package com.jreinhal.querygate.execution;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.querygate.query.FilterNode;
import com.jreinhal.querygate.query.FilterOperator;
import com.jreinhal.querygate.query.OpaqueId;
import com.jreinhal.querygate.query.RegexValue;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MongoCriteriaMapperTest {

    private static final String TENANT = "64b7f0c2a1b2c3d4e5f60718";

    private final MongoCriteriaMapper mapper = new MongoCriteriaMapper();

    @Test
    @DisplayName("Object-id shaped opaque ids match both stored forms")
    void opaqueIdMatchesBothForms() {
        Document document = mapper.toCriteria(new FilterNode.FieldMatch("companyIdf", FilterOperator.EQ, new OpaqueId(TENANT)))
                .getCriteriaObject();

        assertThat(document).isEqualTo(new Document("companyIdf", new Document("$in", List.of(new ObjectId(TENANT), TENANT))));
    }

    @Test
    @DisplayName("Other opaque ids are matched as plain strings")
    void plainOpaqueId() {
        Document document = mapper.toCriteria(new FilterNode.FieldMatch("companyIdf", FilterOperator.EQ, new OpaqueId("acme")))
                .getCriteriaObject();

        assertThat(document).isEqualTo(new Document("companyIdf", "acme"));
    }

    @Test
    @DisplayName("In-lists expand opaque ids and keep other values")
    void inListExpandsIds() {
        Document document = mapper.toCriteria(new FilterNode.FieldMatch("_id", FilterOperator.IN,
                List.of(new OpaqueId(TENANT), "legacy"))).getCriteriaObject();

        assertThat(document).isEqualTo(new Document("_id", new Document("$in", List.of(new ObjectId(TENANT), TENANT, "legacy"))));
    }

    @Test
    @DisplayName("Date operands reach the store as BSON dates")
    void dateOperands() {
        Date from = Date.from(Instant.parse("2024-01-01T00:00:00Z"));

        Document document = mapper.toCriteria(new FilterNode.FieldMatch("created_at", FilterOperator.GTE, from)).getCriteriaObject();

        assertThat(document).isEqualTo(new Document("created_at", new Document("$gte", from)));
        assertThat(((Document) document.get("created_at")).get("$gte")).isInstanceOf(Date.class);
    }

    @Test
    @DisplayName("Range comparisons on ids use the ObjectId form")
    void idRange() {
        Document document = mapper.toCriteria(new FilterNode.FieldMatch("site", FilterOperator.GT, new OpaqueId(TENANT))).getCriteriaObject();

        assertThat(document).isEqualTo(new Document("site", new Document("$gt", new ObjectId(TENANT))));
    }

    @Test
    @DisplayName("Excluded ids exclude both stored forms")
    void opaqueIdNotEqual() {
        Document document = mapper.toCriteria(new FilterNode.FieldMatch("site", FilterOperator.NE, new OpaqueId(TENANT))).getCriteriaObject();

        assertThat(document).isEqualTo(new Document("site", new Document("$nin", List.of(new ObjectId(TENANT), TENANT))));
    }

    @Test
    @DisplayName("Match-nothing predicate renders as an empty id list")
    void matchNone() {
        assertThat(mapper.toCriteria(FilterNode.matchNone()).getCriteriaObject())
                .isEqualTo(new Document("_id", new Document("$in", List.of())));
    }

    @Test
    @DisplayName("Logical nodes map to $and / $or")
    void logicalNodes() {
        FilterNode node = new FilterNode.And(List.of(
                new FilterNode.FieldMatch("status", FilterOperator.NE, "Closed"),
                new FilterNode.Or(List.of(
                        new FilterNode.FieldMatch("stock_quantity", FilterOperator.LT, 10),
                        new FilterNode.FieldMatch("title", FilterOperator.REGEX, new RegexValue("cement", "i"))))));

        Document document = mapper.toCriteria(node).getCriteriaObject();

        assertThat(document).containsOnlyKeys("$and");
        List<?> parts = (List<?>) document.get("$and");
        assertThat(parts).hasSize(2);
        assertThat(parts.get(0)).isEqualTo(new Document("status", new Document("$ne", "Closed")));
        assertThat((Document) parts.get(1)).containsOnlyKeys("$or");
    }

    @Test
    void existsAndEmptyAnd() {
        assertThat(mapper.toCriteria(new FilterNode.FieldMatch("approved_by", FilterOperator.EXISTS, false)).getCriteriaObject())
                .isEqualTo(new Document("approved_by", new Document("$exists", false)));
        assertThat(mapper.toCriteria(FilterNode.matchAll()).getCriteriaObject()).isEmpty();
    }
}
