package com.fsnow.indexadvisor.integration;

import com.fsnow.indexadvisor.model.Condition;
import com.fsnow.indexadvisor.model.Predicate;
import org.bson.Document;

import java.util.List;

/**
 * Translates normalized predicates back into an MQL filter document.
 */
public final class PredicateFilters {
    
    private PredicateFilters() {}
    
    /**
     * Builds the filter for a conjunction of predicates. Every condition is written in
     * operator form, e.g. {@code {name: {$eq: "bob"}, age: {$gte: 18, $lt: 65}}}, so embedded
     * documents are compared literally.
     */
    public static Document toFilter(List<Predicate> conjunction) {
        Document filter = new Document();
        for (Predicate predicate : conjunction) {
            Document conditions = new Document();
            for (Condition condition : predicate.getConditions()) {
                conditions.append(condition.getOperator().getKeyword(), condition.getOperand());
            }
            filter.append(predicate.getField(), conditions);
        }
        return filter;
    }
}
