package com.fsnow.indexadvisor.parser;

import com.fsnow.indexadvisor.integration.PredicateFilters;
import com.fsnow.indexadvisor.model.Condition;
import com.fsnow.indexadvisor.model.OperationType;
import com.fsnow.indexadvisor.model.Operator;
import com.fsnow.indexadvisor.model.Predicate;
import com.fsnow.indexadvisor.model.PredicateClass;
import com.fsnow.indexadvisor.model.Query;
import com.fsnow.indexadvisor.model.RawQuery;
import org.bson.BsonRegularExpression;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class QueryNormalizerTest {
    
    private QueryNormalizer normalizer;
    
    @BeforeEach
    void setUp() {
        normalizer = new QueryNormalizer(100);
    }
    
    @Test
    void testSimpleEqualityCriteria() {
        // Test: { userId: 1 }
        Query query = normalizer.normalize(Criteria.where("userId").is(1), null);
        
        assertThat(query.isSupported()).isTrue();
        assertThat(query.getPredicates()).containsExactly(new Predicate("userId", Operator.EQ, 1));
        assertThat(query.getSortSpec()).isEmpty();
    }
    
    @Test
    void testMultipleFieldsKeepInputOrder() {
        // Test: { userId: 1, status: "active", score: { $gte: 80 } }
        Criteria criteria = Criteria.where("userId").is(1)
                .and("status").is("active")
                .and("score").gte(80);
        
        Query query = normalizer.normalize(criteria, null);
        
        assertThat(query.getPredicateFields()).containsExactly("userId", "status", "score");
        assertThat(query.getPredicate("status").get().getPredicateClass()).isEqualTo(PredicateClass.EQUALITY);
        assertThat(query.getPredicate("score").get().getPredicateClass()).isEqualTo(PredicateClass.RANGE);
    }
    
    @Test
    void testInOperatorIsEquality() {
        // Test: { status: { $in: ["active", "pending"] } }
        Query query = normalizer.normalize(Criteria.where("status").in("active", "pending"), null);
        
        Predicate predicate = query.getPredicate("status").get();
        assertThat(predicate.getOperator()).isEqualTo(Operator.IN);
        assertThat(predicate.getPredicateClass()).isEqualTo(PredicateClass.EQUALITY);
        assertThat(predicate.getOperand()).isEqualTo(Arrays.asList("active", "pending"));
    }
    
    @Test
    void testLargeInListIsRange() {
        // Test: { status: { $in: ["a", "b", "c"] } } with a threshold of 2
        QueryNormalizer strict = new QueryNormalizer(2);
        
        Query query = strict.normalize(Criteria.where("status").in("a", "b", "c"), null);
        
        assertThat(query.getPredicate("status").get().getPredicateClass()).isEqualTo(PredicateClass.RANGE);
    }
    
    @Test
    void testExclusionOperators() {
        // Test: { status: { $ne: "deleted" }, type: { $nin: [1, 2] } }
        Criteria criteria = Criteria.where("status").ne("deleted").and("type").nin(1, 2);
        
        Query query = normalizer.normalize(criteria, null);
        
        assertThat(query.getPredicate("status").get().getPredicateClass()).isEqualTo(PredicateClass.EXCLUSION);
        assertThat(query.getPredicate("type").get().getPredicateClass()).isEqualTo(PredicateClass.EXCLUSION);
    }
    
    @Test
    void testExistenceAndPatternOperators() {
        // Test: { email: { $exists: true }, tags: { $size: 3 }, name: /^bo/ }
        Criteria criteria = Criteria.where("email").exists(true)
                .and("tags").size(3)
                .and("name").regex("^bo");
        
        Query query = normalizer.normalize(criteria, null);
        
        assertThat(query.isSupported()).isTrue();
        assertThat(query.getPredicates())
                .extracting(Predicate::getPredicateClass)
                .containsOnly(PredicateClass.EXISTENCE_PATTERN);
        assertThat(query.getPredicate("name").get().getOperator()).isEqualTo(Operator.REGEX);
        assertThat(query.getPredicate("name").get().getOperand()).isEqualTo(new BsonRegularExpression("^bo"));
    }
    
    @Test
    void testRegexWithOptions() {
        // Test: { name: { $regex: "^bo", $options: "i" } }
        Document filter = new Document("name", new Document("$regex", "^bo").append("$options", "i"));
        
        Query query = normalizer.normalize(RawQuery.find(filter));
        
        Predicate predicate = query.getPredicate("name").get();
        assertThat(predicate.getConditions()).hasSize(1);
        assertThat(predicate.getOperand()).isEqualTo(new BsonRegularExpression("^bo", "i"));
    }
    
    @Test
    void testPatternsInsideInListHaveValueEquality() {
        // Test: { name: { $in: [/^bo/i, "carol"] } } logged twice
        Document first = new Document("name", new Document("$in",
                Arrays.asList(Pattern.compile("^bo", Pattern.CASE_INSENSITIVE), "carol")));
        Document second = new Document("name", new Document("$in",
                Arrays.asList(Pattern.compile("^bo", Pattern.CASE_INSENSITIVE), "carol")));

        Query one = normalizer.normalize(RawQuery.find(first));
        Query two = normalizer.normalize(RawQuery.find(second));

        assertThat(one.getPredicate("name").get().getOperand())
                .isEqualTo(Arrays.asList(new BsonRegularExpression("^bo", "i"), "carol"));
        assertThat(one).isEqualTo(two);
        assertThat(one.hashCode()).isEqualTo(two.hashCode());
    }

    @Test
    void testRangeWithTwoBounds() {
        // Test: { age: { $gte: 18, $lt: 65 } }
        Query query = normalizer.normalize(Criteria.where("age").gte(18).lt(65), null);
        
        Predicate predicate = query.getPredicate("age").get();
        assertThat(predicate.getPredicateClass()).isEqualTo(PredicateClass.RANGE);
        assertThat(predicate.getConditions()).containsExactly(
                new Condition(Operator.GTE, 18), new Condition(Operator.LT, 65));
    }
    
    @Test
    void testTopLevelAndIsFlattened() {
        // Test: { $and: [{ a: 1 }, { b: { $gt: 5 } }] }
        Document filter = new Document("$and", Arrays.asList(
                new Document("a", 1),
                new Document("b", new Document("$gt", 5))));
        
        Query query = normalizer.normalize(RawQuery.find(filter));
        
        assertThat(query.getPredicateFields()).containsExactly("a", "b");
    }
    
    @Test
    void testRangeBoundsSplitAcrossAndAreMerged() {
        // Test: { a: { $gt: 1 }, $and: [{ a: { $lt: 5 } }] }
        Document filter = new Document("a", new Document("$gt", 1))
                .append("$and", List.of(new Document("a", new Document("$lt", 5))));
        
        Query query = normalizer.normalize(RawQuery.find(filter));
        
        assertThat(query.isSupported()).isTrue();
        assertThat(query.getPredicates()).hasSize(1);
        assertThat(query.getPredicate("a").get().getConditions()).hasSize(2);
    }
    
    @Test
    void testEmbeddedDocumentIsEquality() {
        // Test: { address: { city: "Paris" } }
        Document filter = new Document("address", new Document("city", "Paris"));
        
        Query query = normalizer.normalize(RawQuery.find(filter));
        
        Predicate predicate = query.getPredicate("address").get();
        assertThat(predicate.getOperator()).isEqualTo(Operator.EQ);
        assertThat(predicate.getOperand()).isEqualTo(new Document("city", "Paris"));
    }
    
    @Test
    void testCommentIsIgnored() {
        Document filter = new Document("$comment", "nightly report").append("a", 1);
        
        Query query = normalizer.normalize(RawQuery.find(filter));
        
        assertThat(query.getPredicateFields()).containsExactly("a");
    }
    
    @Test
    void testOrIsUnsupported() {
        Criteria criteria = new Criteria().orOperator(Criteria.where("a").is(1), Criteria.where("b").is(2));
        
        Query query = normalizer.normalize(criteria, null);
        
        assertThat(query.isSupported()).isFalse();
        assertThat(query.getUnsupportedReason()).contains("$or");
        assertThat(query.getPredicates()).isEmpty();
    }
    
    @Test
    void testNorIsUnsupported() {
        Document filter = new Document("$nor", List.of(new Document("a", 1)));
        
        assertThat(normalizer.normalize(RawQuery.find(filter)).isSupported()).isFalse();
    }
    
    @Test
    void testUnknownOperatorIsUnsupported() {
        // Test: { items: { $elemMatch: { qty: { $gt: 5 } } } }
        Criteria criteria = Criteria.where("items").elemMatch(Criteria.where("qty").gt(5));
        
        Query query = normalizer.normalize(criteria, null);
        
        assertThat(query.isSupported()).isFalse();
        assertThat(query.getUnsupportedReason()).contains("$elemMatch");
    }
    
    @Test
    void testUnsupportedShapes() {
        List<Document> filters = Arrays.asList(
                // Conflicting classes on one field
                new Document("a", new Document("$in", List.of(1)).append("$gt", 3)),
                // Repeated operator across $and
                new Document("a", new Document("$gt", 1))
                        .append("$and", List.of(new Document("a", new Document("$gt", 2)))),
                // Two equality conditions on one field
                new Document("a", 1).append("$and", List.of(new Document("a", 2))),
                // Operators mixed with plain keys
                new Document("a", new Document("$gt", 1).append("b", 2)),
                // $options without $regex
                new Document("a", new Document("$options", "i")),
                // Nested $and
                new Document("$and", List.of(new Document("$and", List.of(new Document("a", 1))))),
                // Other top-level operators
                new Document("$where", "this.a > 1"),
                // $in without an array
                new Document("a", new Document("$in", 5)));
        
        for (Document filter : filters) {
            Query query = normalizer.normalize(RawQuery.find(filter));
            assertThat(query.isSupported()).as(filter.toJson()).isFalse();
            assertThat(query.getUnsupportedReason()).as(filter.toJson()).isNotBlank();
        }
    }
    
    @Test
    void testNonFilterOperationIsUnsupported() {
        RawQuery raw = RawQuery.builder().operationType(OperationType.AGGREGATE).build();
        
        Query query = normalizer.normalize(raw);
        
        assertThat(query.isSupported()).isFalse();
        assertThat(query.getOperationType()).isEqualTo(OperationType.AGGREGATE);
    }
    
    @Test
    void testSortAndProjection() {
        // Test: find({ a: 1 }, { a: 1, _id: 0 }).sort({ c: 1, d: -1 })
        RawQuery raw = RawQuery.builder()
                .filter(new Document("a", 1))
                .sort(new Document("c", 1).append("d", -1))
                .projection(new Document("a", 1).append("_id", 0))
                .limit(10)
                .build();
        
        Query query = normalizer.normalize(raw);
        
        assertThat(query.getSortSpec()).containsExactly("c", "d");
        assertThat(query.getProjection()).containsExactly("a");
        assertThat(query.getLimit()).isEqualTo(10);
    }
    
    @Test
    void testSpringSortIsConverted() {
        Sort sort = Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.ASC, "score"));
        
        Query query = normalizer.normalize(Criteria.where("userId").is(1), sort);
        
        assertThat(query.getSortSpec()).containsExactly("createdAt", "score");
    }
    
    @Test
    void testEmptyCriteria() {
        Query query = normalizer.normalize(null, Sort.unsorted());
        
        assertThat(query.isSupported()).isTrue();
        assertThat(query.getPredicates()).isEmpty();
        assertThat(query.getSortSpec()).isEmpty();
    }
    
    @Test
    void testNormalizationIsIdempotent() {
        // Test: { a: 1, b: { $gt: 5, $lte: 9 }, name: /^bo/i } sorted by c
        Document filter = new Document("a", 1)
                .append("b", new Document("$gt", 5).append("$lte", 9))
                .append("name", Pattern.compile("^bo", Pattern.CASE_INSENSITIVE));
        Document sort = new Document("c", 1);
        
        Query first = normalizer.normalize(RawQuery.builder().filter(filter).sort(sort).build());
        Query again = normalizer.normalize(RawQuery.builder().filter(filter).sort(sort).build());
        Query rendered = normalizer.normalize(RawQuery.builder()
                .filter(PredicateFilters.toFilter(first.getPredicates()))
                .sort(sort)
                .build());
        
        assertThat(first.isSupported()).isTrue();
        assertThat(again).isEqualTo(first);
        assertThat(rendered).isEqualTo(first);
    }
}
