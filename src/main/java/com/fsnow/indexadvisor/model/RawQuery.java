package com.fsnow.indexadvisor.model;

import org.bson.Document;

import java.util.Objects;

/**
 * A logged operation as read from a workload source, before normalization.
 */
public class RawQuery {
    private final Document filter;
    private final Document sort;
    private final Document projection;
    private final Integer limit;
    private final OperationType operationType;
    
    private RawQuery(Builder builder) {
        this.filter = builder.filter != null ? builder.filter : new Document();
        this.sort = builder.sort != null ? builder.sort : new Document();
        this.projection = builder.projection;
        this.limit = builder.limit;
        this.operationType = builder.operationType;
    }
    
    public Document getFilter() {
        return filter;
    }
    
    public Document getSort() {
        return sort;
    }
    
    public Document getProjection() {
        return projection;
    }
    
    public Integer getLimit() {
        return limit;
    }
    
    public OperationType getOperationType() {
        return operationType;
    }
    
    /**
     * Shorthand for a find operation with the given filter and no sort.
     */
    public static RawQuery find(Document filter) {
        return builder().filter(filter).build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return String.format("RawQuery{op=%s, filter=%s, sort=%s}", operationType, filter.toJson(), sort.toJson());
    }
    
    /**
     * Builder for RawQuery.
     */
    public static class Builder {
        private Document filter;
        private Document sort;
        private Document projection;
        private Integer limit;
        private OperationType operationType = OperationType.FIND;
        
        private Builder() {}
        
        public Builder filter(Document filter) {
            this.filter = filter;
            return this;
        }
        
        public Builder sort(Document sort) {
            this.sort = sort;
            return this;
        }
        
        public Builder projection(Document projection) {
            this.projection = projection;
            return this;
        }
        
        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }
        
        public Builder operationType(OperationType operationType) {
            this.operationType = Objects.requireNonNull(operationType, "Operation type cannot be null");
            return this;
        }
        
        public RawQuery build() {
            return new RawQuery(this);
        }
    }
}
