package com.fsnow.indexadvisor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A distinct query shape observed in the workload together with how often it occurred.
 * <p>
 * The shape (fields, predicate classes and sort order) is fixed by the first query recorded;
 * later queries of the same shape only bump the frequency and may be kept as additional
 * representatives for binding operand values. The aggregator keeps one entry per shape,
 * so entries compare by identity.
 */
public class WorkloadEntry {
    private final QueryShape shape;
    private final Map<String, PredicateClass> fieldClasses;
    private final List<String> sortSpec;
    private final List<Query> representatives;
    private final int maxRepresentatives;
    private long frequency;
    
    public WorkloadEntry(Query firstQuery, int maxRepresentatives) {
        Objects.requireNonNull(firstQuery, "Query cannot be null");
        if (maxRepresentatives <= 0) {
            throw new IllegalArgumentException("At least one representative must be kept");
        }
        this.maxRepresentatives = maxRepresentatives;
        this.shape = QueryShape.of(firstQuery);
        
        Map<String, PredicateClass> classes = new LinkedHashMap<>();
        for (Predicate predicate : firstQuery.getPredicates()) {
            classes.put(predicate.getField(), predicate.getPredicateClass());
        }
        this.fieldClasses = Collections.unmodifiableMap(classes);
        this.sortSpec = firstQuery.getSortSpec();
        this.representatives = new ArrayList<>();
        this.representatives.add(firstQuery);
        this.frequency = 1;
    }
    
    /**
     * Counts another occurrence of this shape.
     */
    public void record(Query query) {
        frequency++;
        if (representatives.size() < maxRepresentatives && !representatives.contains(query)) {
            representatives.add(query);
        }
    }
    
    public QueryShape getShape() {
        return shape;
    }
    
    /**
     * Predicate fields in the order of the first recorded query.
     */
    public List<String> getPredicateFields() {
        return new ArrayList<>(fieldClasses.keySet());
    }
    
    public PredicateClass getPredicateClass(String field) {
        return fieldClasses.get(field);
    }
    
    public List<String> getSortSpec() {
        return sortSpec;
    }
    
    public List<Query> getRepresentatives() {
        return Collections.unmodifiableList(representatives);
    }
    
    public long getFrequency() {
        return frequency;
    }
    
    @Override
    public String toString() {
        return String.format("WorkloadEntry{shape='%s', frequency=%d}", shape, frequency);
    }
}
