package com.fsnow.indexadvisor.model;

import java.util.Objects;

/**
 * One key of an existing index: a field path and its key direction (1 or -1).
 * The advisor compares existing keys by field path only.
 */
public class IndexField {
    private final String field;
    private final int direction;
    
    public IndexField(String field, int direction) {
        this.field = Objects.requireNonNull(field, "Field name cannot be null");
        if (direction != 1 && direction != -1) {
            throw new IllegalArgumentException(String.format("Invalid direction %d for key '%s'", direction, field));
        }
        this.direction = direction;
    }
    
    public String getField() {
        return field;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IndexField that = (IndexField) o;
        return direction == that.direction && field.equals(that.field);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(field, direction);
    }
    
    @Override
    public String toString() {
        return field + ":" + direction;
    }
}
