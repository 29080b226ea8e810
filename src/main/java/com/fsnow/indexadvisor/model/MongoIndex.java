package com.fsnow.indexadvisor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An index that already exists on a collection.
 */
public class MongoIndex {
    private final String name;
    private final List<IndexField> fields;
    
    public MongoIndex(String name, List<IndexField> fields) {
        this.name = Objects.requireNonNull(name, "Index name cannot be null");
        this.fields = new ArrayList<>(Objects.requireNonNull(fields, "Index fields cannot be null"));
    }
    
    public String getName() {
        return name;
    }
    
    public List<IndexField> getFields() {
        return Collections.unmodifiableList(fields);
    }
    
    private List<String> getFieldNames() {
        List<String> names = new ArrayList<>();
        for (IndexField field : fields) {
            names.add(field.getField());
        }
        return names;
    }
    
    /**
     * Checks if this index already serves a candidate, i.e. the candidate's fields are
     * a prefix of (or equal to) this index's key fields. Directions are ignored.
     */
    public boolean serves(IndexCandidate candidate) {
        List<String> names = getFieldNames();
        List<String> wanted = candidate.getFields();
        return wanted.size() <= names.size() && names.subList(0, wanted.size()).equals(wanted);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MongoIndex that = (MongoIndex) o;
        return Objects.equals(name, that.name) && Objects.equals(fields, that.fields);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, fields);
    }
    
    @Override
    public String toString() {
        return String.format("MongoIndex{name='%s', fields=%s}", name, fields);
    }
}
