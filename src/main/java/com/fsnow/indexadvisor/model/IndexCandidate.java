package com.fsnow.indexadvisor.model;

import org.bson.Document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A proposed ascending index, identified by its ordered field sequence.
 * Estimation fills in the statistics, scoring fills in the score.
 */
public class IndexCandidate {
    private static final int ASCENDING = 1;
    
    private final List<String> fields;
    private final Set<WorkloadEntry> contributingEntries = new LinkedHashSet<>();
    private SampleStatistics statistics;
    private double selectivity = 1.0;
    private double score;
    
    public IndexCandidate(List<String> fields) {
        Objects.requireNonNull(fields, "Index fields cannot be null");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("An index needs at least one field");
        }
        if (new LinkedHashSet<>(fields).size() != fields.size()) {
            throw new IllegalArgumentException("Duplicate index fields: " + fields);
        }
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }
    
    public List<String> getFields() {
        return fields;
    }
    
    public int size() {
        return fields.size();
    }
    
    public Set<WorkloadEntry> getContributingEntries() {
        return Collections.unmodifiableSet(contributingEntries);
    }
    
    public void addContributingEntry(WorkloadEntry entry) {
        contributingEntries.add(entry);
    }
    
    /**
     * Sum of the frequencies of all contributing entries.
     */
    public long totalFrequency() {
        return contributingEntries.stream().mapToLong(WorkloadEntry::getFrequency).sum();
    }
    
    public SampleStatistics getStatistics() {
        return statistics;
    }
    
    /**
     * Attaches sample statistics and takes the full-length selectivity from them.
     */
    public void applyStatistics(SampleStatistics statistics) {
        if (statistics.getPrefixCount() != fields.size()) {
            throw new IllegalArgumentException(String.format(
                    "Statistics cover %d prefixes, index %s has %d fields",
                    statistics.getPrefixCount(), fields, fields.size()));
        }
        this.statistics = statistics;
        this.selectivity = statistics.selectivityAt(fields.size());
    }
    
    public double getSelectivity() {
        return selectivity;
    }
    
    public double getScore() {
        return score;
    }
    
    public void setScore(double score) {
        this.score = score;
    }
    
    /**
     * Checks whether this candidate's fields are a strict prefix of the other's.
     */
    public boolean isStrictPrefixOf(IndexCandidate other) {
        return fields.size() < other.fields.size()
                && other.fields.subList(0, fields.size()).equals(fields);
    }
    
    /**
     * The MongoDB key specification, e.g. {@code {a: 1, c: 1, b: 1}}.
     */
    public Document indexKeys() {
        Document keys = new Document();
        for (String field : fields) {
            keys.append(field, ASCENDING);
        }
        return keys;
    }
    
    /**
     * The default index name MongoDB would assign, e.g. {@code a_1_c_1_b_1}.
     */
    public String indexName() {
        StringBuilder name = new StringBuilder();
        for (String field : fields) {
            if (name.length() > 0) {
                name.append('_');
            }
            name.append(field).append('_').append(ASCENDING);
        }
        return name.toString();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((IndexCandidate) o).fields);
    }
    
    @Override
    public int hashCode() {
        return fields.hashCode();
    }
    
    @Override
    public String toString() {
        return String.format("IndexCandidate{fields=%s, selectivity=%.4f, score=%.3f}", fields, selectivity, score);
    }
}
