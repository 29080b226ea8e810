package com.fsnow.indexadvisor.candidate;

import com.fsnow.indexadvisor.model.IndexCandidate;
import com.fsnow.indexadvisor.model.PredicateClass;
import com.fsnow.indexadvisor.model.RawQuery;
import com.fsnow.indexadvisor.model.WorkloadEntry;
import com.fsnow.indexadvisor.parser.QueryNormalizer;
import com.fsnow.indexadvisor.workload.WorkloadAggregator;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for ESR-based candidate generation.
 */
class CandidateGeneratorTest {
    
    private final QueryNormalizer normalizer = new QueryNormalizer(100);
    private CandidateGenerator generator;
    private WorkloadAggregator aggregator;
    
    @BeforeEach
    void setUp() {
        generator = new CandidateGenerator();
        aggregator = new WorkloadAggregator(5);
    }
    
    private void add(Document filter, Document sort) {
        aggregator.add(normalizer.normalize(RawQuery.builder().filter(filter).sort(sort).build()));
    }
    
    private void add(Document filter) {
        add(filter, null);
    }
    
    private List<List<String>> fieldsOf(List<IndexCandidate> candidates) {
        return candidates.stream().map(IndexCandidate::getFields).collect(Collectors.toList());
    }
    
    @Test
    void testEqualitySortRangeOrdering() {
        // Test: { a: 1, b: { $gt: 5 } } sorted by { c: 1 }
        add(new Document("a", 1).append("b", new Document("$gt", 5)), new Document("c", 1));
        
        List<IndexCandidate> candidates = generator.generate(aggregator.getEntries());
        
        assertThat(fieldsOf(candidates)).containsExactly(
                List.of("a", "c", "b"),
                List.of("a"),
                List.of("b"));
    }
    
    @Test
    void testOneCandidatePerRangeField() {
        // Test: { a: 1, x: { $gt: 1 }, y: { $lt: 2 } }
        add(new Document("a", 1)
                .append("x", new Document("$gt", 1))
                .append("y", new Document("$lt", 2)));
        
        List<IndexCandidate> candidates = generator.generate(aggregator.getEntries());
        
        assertThat(fieldsOf(candidates)).containsExactly(
                List.of("a", "x"),
                List.of("a", "y"),
                List.of("a"),
                List.of("x"),
                List.of("y"));
    }
    
    @Test
    void testExclusionTakesRangePositionWithoutRange() {
        // Test: { a: 1, status: { $ne: "deleted" } }
        add(new Document("a", 1).append("status", new Document("$ne", "deleted")));
        
        List<IndexCandidate> candidates = generator.generate(aggregator.getEntries());
        
        assertThat(fieldsOf(candidates)).containsExactly(
                List.of("a", "status"),
                List.of("a"),
                List.of("status"));
    }
    
    @Test
    void testExclusionIsIgnoredWhenRangeExists() {
        // Test: { status: { $ne: "deleted" }, age: { $gt: 30 } }
        add(new Document("status", new Document("$ne", "deleted")).append("age", new Document("$gt", 30)));
        
        List<IndexCandidate> candidates = generator.generate(aggregator.getEntries());
        
        assertThat(fieldsOf(candidates)).containsExactly(
                List.of("age"),
                List.of("status"));
    }
    
    @Test
    void testSortFieldBoundByEqualityIsSkipped() {
        // Test: { a: 1 } sorted by { a: 1, b: 1 }
        add(new Document("a", 1), new Document("a", 1).append("b", 1));
        
        List<IndexCandidate> candidates = generator.generate(aggregator.getEntries());
        
        assertThat(fieldsOf(candidates)).containsExactly(List.of("a", "b"), List.of("a"));
    }
    
    @Test
    void testRangeFieldAlsoSortedAppearsOnce() {
        // Test: { b: { $gt: 1 } } sorted by { b: 1 }
        add(new Document("b", new Document("$gt", 1)), new Document("b", 1));
        
        List<IndexCandidate> candidates = generator.generate(aggregator.getEntries());
        
        assertThat(fieldsOf(candidates)).containsExactly(List.of("b"));
    }
    
    @Test
    void testSortOnlyQuery() {
        add(new Document(), new Document("c", 1).append("d", -1));
        
        List<IndexCandidate> candidates = generator.generate(aggregator.getEntries());
        
        assertThat(fieldsOf(candidates)).containsExactly(List.of("c", "d"));
    }
    
    @Test
    void testFullScanYieldsNothing() {
        add(new Document());
        
        assertThat(generator.generate(aggregator.getEntries())).isEmpty();
    }
    
    @Test
    void testExistenceFieldsOnlyGetSingleFieldCandidates() {
        // Test: { e: { $exists: true }, a: 1 }
        add(new Document("e", new Document("$exists", true)).append("a", 1));
        
        List<IndexCandidate> candidates = generator.generate(aggregator.getEntries());
        
        assertThat(fieldsOf(candidates)).containsExactly(List.of("a"), List.of("e"));
    }
    
    @Test
    void testSharedSequenceCollectsAllContributors() {
        add(new Document("a", 1));
        add(new Document("a", 2));
        add(new Document("a", 1).append("b", new Document("$gt", 1)));
        
        List<IndexCandidate> candidates = generator.generate(aggregator.getEntries());
        
        IndexCandidate single = candidates.stream()
                .filter(c -> c.getFields().equals(List.of("a")))
                .findFirst()
                .orElseThrow();
        assertThat(single.getContributingEntries()).hasSize(2);
        assertThat(single.totalFrequency()).isEqualTo(3);
        assertThat(candidates).doesNotHaveDuplicates();
    }
    
    @Test
    void testEveryCandidateFollowsEsrOrder() {
        add(new Document("a", 1).append("b", new Document("$gt", 5)).append("c", "x"), new Document("d", 1));
        add(new Document("e", new Document("$in", List.of(1, 2))).append("f", new Document("$lte", 3)),
                new Document("g", 1).append("h", 1));
        add(new Document("k", new Document("$nin", List.of(1))), new Document("m", -1));
        
        for (WorkloadEntry entry : aggregator.getEntries()) {
            for (List<String> fields : generator.fieldSequences(entry)) {
                int lastRank = -1;
                for (String field : fields) {
                    int rank = esrRank(entry, field);
                    assertThat(rank).as("%s in %s", field, fields).isGreaterThanOrEqualTo(lastRank);
                    lastRank = rank;
                }
            }
        }
    }
    
    private int esrRank(WorkloadEntry entry, String field) {
        PredicateClass predicateClass = entry.getPredicateClass(field);
        if (predicateClass == PredicateClass.EQUALITY) {
            return 0;
        }
        if (predicateClass == null) {
            // Sort-only field
            return 1;
        }
        return 2;
    }
}
