package com.fsnow.indexadvisor.model;

/**
 * Classifies a predicate by how it can use an index key.
 */
public enum PredicateClass {
    /**
     * Point lookups: direct value assignment, $eq, $in
     */
    EQUALITY,
    
    /**
     * Bounded scans: $gt, $gte, $lt, $lte
     */
    RANGE,
    
    /**
     * Negations: $ne, $nin
     */
    EXCLUSION,
    
    /**
     * Existence and pattern checks: $exists, $regex, $size
     */
    EXISTENCE_PATTERN
}
