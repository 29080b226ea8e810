package com.fsnow.indexadvisor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A normalized logged operation.
 * <p>
 * Predicates keep the order in which their fields appeared in the raw filter, and the
 * sort order keeps document order. Field paths are unique among the predicates.
 */
public class Query {
    private final List<Predicate> predicates;
    private final List<String> sortSpec;
    private final List<String> projection;
    private final Integer limit;
    private final OperationType operationType;
    private final boolean supported;
    private final String unsupportedReason;
    
    private Query(Builder builder) {
        this.predicates = Collections.unmodifiableList(new ArrayList<>(builder.predicates));
        this.sortSpec = Collections.unmodifiableList(new ArrayList<>(builder.sortSpec));
        this.projection = Collections.unmodifiableList(new ArrayList<>(builder.projection));
        this.limit = builder.limit;
        this.operationType = builder.operationType;
        this.supported = builder.unsupportedReason == null;
        this.unsupportedReason = builder.unsupportedReason;
    }
    
    public List<Predicate> getPredicates() {
        return predicates;
    }
    
    public List<String> getSortSpec() {
        return sortSpec;
    }
    
    public List<String> getProjection() {
        return projection;
    }
    
    public Integer getLimit() {
        return limit;
    }
    
    public OperationType getOperationType() {
        return operationType;
    }
    
    public boolean isSupported() {
        return supported;
    }
    
    /**
     * Why the query was rejected, or null for supported queries.
     */
    public String getUnsupportedReason() {
        return unsupportedReason;
    }
    
    /**
     * Finds the predicate bound to a field path.
     */
    public Optional<Predicate> getPredicate(String field) {
        return predicates.stream()
                .filter(p -> p.getField().equals(field))
                .findFirst();
    }
    
    /**
     * Predicate field paths in input order.
     */
    public List<String> getPredicateFields() {
        List<String> fields = new ArrayList<>();
        for (Predicate predicate : predicates) {
            fields.add(predicate.getField());
        }
        return fields;
    }
    
    public static Query unsupported(String reason, OperationType operationType) {
        return new Builder()
                .operationType(operationType)
                .unsupportedReason(Objects.requireNonNull(reason, "Reason cannot be null"))
                .build();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Query query = (Query) o;
        return supported == query.supported
                && Objects.equals(predicates, query.predicates)
                && Objects.equals(sortSpec, query.sortSpec)
                && Objects.equals(projection, query.projection)
                && Objects.equals(limit, query.limit)
                && operationType == query.operationType
                && Objects.equals(unsupportedReason, query.unsupportedReason);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(predicates, sortSpec, projection, limit, operationType, supported, unsupportedReason);
    }
    
    @Override
    public String toString() {
        if (!supported) {
            return String.format("Query{unsupported='%s'}", unsupportedReason);
        }
        return String.format("Query{predicates=%s, sort=%s}", predicates, sortSpec);
    }
    
    /**
     * Builder for Query.
     */
    public static class Builder {
        private final List<Predicate> predicates = new ArrayList<>();
        private final List<String> sortSpec = new ArrayList<>();
        private final List<String> projection = new ArrayList<>();
        private Integer limit;
        private OperationType operationType = OperationType.FIND;
        private String unsupportedReason;
        
        public Builder addPredicate(Predicate predicate) {
            boolean duplicate = predicates.stream().anyMatch(p -> p.getField().equals(predicate.getField()));
            if (duplicate) {
                throw new IllegalArgumentException("Field already constrained: " + predicate.getField());
            }
            predicates.add(predicate);
            return this;
        }
        
        public Builder addSortField(String field) {
            sortSpec.add(field);
            return this;
        }
        
        public Builder addProjectionField(String field) {
            projection.add(field);
            return this;
        }
        
        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }
        
        public Builder operationType(OperationType operationType) {
            this.operationType = operationType;
            return this;
        }
        
        private Builder unsupportedReason(String reason) {
            this.unsupportedReason = reason;
            return this;
        }
        
        public Query build() {
            return new Query(this);
        }
    }
}
