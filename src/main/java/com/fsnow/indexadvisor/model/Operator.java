package com.fsnow.indexadvisor.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Query operators recognized by the normalizer.
 */
public enum Operator {
    EQ("$eq", PredicateClass.EQUALITY),
    IN("$in", PredicateClass.EQUALITY),
    EXISTS("$exists", PredicateClass.EXISTENCE_PATTERN),
    REGEX("$regex", PredicateClass.EXISTENCE_PATTERN),
    SIZE("$size", PredicateClass.EXISTENCE_PATTERN),
    NE("$ne", PredicateClass.EXCLUSION),
    NIN("$nin", PredicateClass.EXCLUSION),
    GT("$gt", PredicateClass.RANGE),
    GTE("$gte", PredicateClass.RANGE),
    LT("$lt", PredicateClass.RANGE),
    LTE("$lte", PredicateClass.RANGE);
    
    private final String keyword;
    private final PredicateClass defaultClass;
    
    Operator(String keyword, PredicateClass defaultClass) {
        this.keyword = keyword;
        this.defaultClass = defaultClass;
    }
    
    /**
     * The MQL keyword, including the leading dollar sign.
     */
    public String getKeyword() {
        return keyword;
    }
    
    /**
     * The class of this operator when the operand does not change it.
     * Only {@link #IN} can be reclassified, see the normalizer's cardinality threshold.
     */
    public PredicateClass getDefaultClass() {
        return defaultClass;
    }
    
    public static Optional<Operator> fromKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(op -> op.keyword.equals(keyword))
                .findFirst();
    }
}
