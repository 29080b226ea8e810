package com.fsnow.indexadvisor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The structure of a normalized query: its (field, predicate class) pairs sorted by field,
 * followed by the sort fields in order. Operand values do not take part.
 * <p>
 * Two queries belong to the same workload entry exactly when their shapes are equal.
 * Equality compares the parts structurally, so field names containing separators
 * cannot make two different shapes collide.
 */
public final class QueryShape {
    private final List<Map.Entry<String, PredicateClass>> predicates;
    private final List<String> sortFields;

    private QueryShape(List<Map.Entry<String, PredicateClass>> predicates, List<String> sortFields) {
        this.predicates = Collections.unmodifiableList(predicates);
        this.sortFields = List.copyOf(sortFields);
    }

    public static QueryShape of(Query query) {
        Objects.requireNonNull(query, "Query cannot be null");
        List<Map.Entry<String, PredicateClass>> pairs = new ArrayList<>();
        for (Predicate predicate : query.getPredicates()) {
            pairs.add(Map.entry(predicate.getField(), predicate.getPredicateClass()));
        }
        pairs.sort(Map.Entry.comparingByKey());
        return new QueryShape(pairs, query.getSortSpec());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueryShape that = (QueryShape) o;
        return predicates.equals(that.predicates) && sortFields.equals(that.sortFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(predicates, sortFields);
    }

    /**
     * Readable form for logging, e.g. {@code filter[a:EQUALITY,b:RANGE]|sort[c]}.
     */
    @Override
    public String toString() {
        String filter = predicates.stream()
                .map(pair -> pair.getKey() + ":" + pair.getValue())
                .collect(Collectors.joining(","));
        return "filter[" + filter + "]|sort[" + String.join(",", sortFields) + "]";
    }
}
