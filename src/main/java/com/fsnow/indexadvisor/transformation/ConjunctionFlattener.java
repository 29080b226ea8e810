package com.fsnow.indexadvisor.transformation;

import com.fsnow.indexadvisor.exception.UnsupportedQueryException;
import com.fsnow.indexadvisor.parser.OperatorAnalyzer;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flattens a query filter into a list of field clauses.
 * <p>
 * A top-level {@code $and} is expanded one level; its clauses are treated as if they were
 * written at the top level. Nested {@code $and}, any {@code $or}/{@code $nor} and any other
 * top-level operator are rejected.
 */
public class ConjunctionFlattener {
    
    /**
     * A single {@code field: condition} pair of a conjunction.
     */
    public static class FieldClause {
        private final String field;
        private final Object condition;
        
        public FieldClause(String field, Object condition) {
            this.field = field;
            this.condition = condition;
        }
        
        public String getField() { return field; }
        public Object getCondition() { return condition; }
    }
    
    /**
     * Extracts the field clauses of a filter in document order.
     */
    public List<FieldClause> flatten(Document filter) {
        List<FieldClause> clauses = new ArrayList<>();
        
        if (filter == null || filter.isEmpty()) {
            return clauses;
        }
        
        for (Map.Entry<String, Object> entry : filter.entrySet()) {
            String key = entry.getKey();
            
            if ("$and".equals(key)) {
                for (Document term : andTerms(entry.getValue())) {
                    for (Map.Entry<String, Object> termEntry : term.entrySet()) {
                        if ("$and".equals(termEntry.getKey())) {
                            throw new UnsupportedQueryException("Nested $and is not supported");
                        }
                        addClause(clauses, termEntry.getKey(), termEntry.getValue());
                    }
                }
            } else {
                addClause(clauses, key, entry.getValue());
            }
        }
        
        return clauses;
    }
    
    private void addClause(List<FieldClause> clauses, String key, Object value) {
        if (OperatorAnalyzer.isDisjunction(key)) {
            throw new UnsupportedQueryException("Disjunction " + key + " is not supported");
        }
        if (OperatorAnalyzer.isIgnoredTopLevelKey(key)) {
            return;
        }
        if (key.startsWith("$")) {
            throw new UnsupportedQueryException("Unsupported top-level operator '" + key + "'");
        }
        if (key.isEmpty()) {
            throw new UnsupportedQueryException("Empty field name");
        }
        clauses.add(new FieldClause(key, value));
    }
    
    private List<Document> andTerms(Object value) {
        if (!(value instanceof List)) {
            throw new UnsupportedQueryException("$and requires an array of documents");
        }
        
        List<Document> terms = new ArrayList<>();
        for (Object term : (List<?>) value) {
            if (!(term instanceof Document)) {
                throw new UnsupportedQueryException("$and requires an array of documents");
            }
            terms.add((Document) term);
        }
        return terms;
    }
}
