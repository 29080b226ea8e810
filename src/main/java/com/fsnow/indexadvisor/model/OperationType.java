package com.fsnow.indexadvisor.model;

/**
 * The kind of logged operation a raw query came from.
 */
public enum OperationType {
    FIND(true),
    COUNT(true),
    DISTINCT(true),
    UPDATE(true),
    DELETE(true),
    FIND_AND_MODIFY(true),
    AGGREGATE(false),
    INSERT(false),
    UNKNOWN(false);
    
    private final boolean filterBased;
    
    OperationType(boolean filterBased) {
        this.filterBased = filterBased;
    }
    
    /**
     * Whether the operation selects documents with a plain filter that an index can serve.
     */
    public boolean isFilterBased() {
        return filterBased;
    }
}
