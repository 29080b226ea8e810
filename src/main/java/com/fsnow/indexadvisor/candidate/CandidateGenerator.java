package com.fsnow.indexadvisor.candidate;

import com.fsnow.indexadvisor.model.IndexCandidate;
import com.fsnow.indexadvisor.model.PredicateClass;
import com.fsnow.indexadvisor.model.WorkloadEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives candidate indexes from workload shapes using the ESR (Equality-Sort-Range) rule.
 * 
 * ESR principle:
 * - Equality fields first (in the query's field order)
 * - At most one sort field next (sort fields already bound by equality are skipped)
 * - At most one range field last; with several range fields, one candidate per choice
 * 
 * Exclusion fields ($ne, $nin) never join the equality prefix but take the range
 * position when the query has no true range field. Every predicate field additionally
 * yields a single-field candidate.
 */
public class CandidateGenerator {
    
    private static final Logger logger = LoggerFactory.getLogger(CandidateGenerator.class);
    
    /**
     * Generates the distinct candidates for all entries. A field sequence produced by several
     * entries becomes one candidate with all of them as contributors.
     */
    public List<IndexCandidate> generate(List<WorkloadEntry> entries) {
        Map<List<String>, IndexCandidate> candidates = new LinkedHashMap<>();
        
        for (WorkloadEntry entry : entries) {
            for (List<String> fields : fieldSequences(entry)) {
                candidates.computeIfAbsent(fields, IndexCandidate::new).addContributingEntry(entry);
            }
        }
        
        logger.info("Generated {} distinct candidates from {} workload shapes", candidates.size(), entries.size());
        return new ArrayList<>(candidates.values());
    }
    
    /**
     * Computes the index field sequences one workload shape can use.
     */
    public List<List<String>> fieldSequences(WorkloadEntry entry) {
        Set<List<String>> sequences = new LinkedHashSet<>();
        List<String> predicateFields = entry.getPredicateFields();
        
        if (predicateFields.isEmpty()) {
            // Full scan or sort-only: the sort fields alone can still avoid an in-memory sort
            if (!entry.getSortSpec().isEmpty()) {
                sequences.add(new ArrayList<>(entry.getSortSpec()));
            }
            return new ArrayList<>(sequences);
        }
        
        // Step 1: Partition predicate fields by class
        List<String> equalityFields = new ArrayList<>();
        List<String> rangeFields = new ArrayList<>();
        List<String> exclusionFields = new ArrayList<>();
        for (String field : predicateFields) {
            PredicateClass predicateClass = entry.getPredicateClass(field);
            if (predicateClass == PredicateClass.EQUALITY) {
                equalityFields.add(field);
            } else if (predicateClass == PredicateClass.RANGE) {
                rangeFields.add(field);
            } else if (predicateClass == PredicateClass.EXCLUSION) {
                exclusionFields.add(field);
            }
        }
        
        List<String> sortFields = new ArrayList<>(entry.getSortSpec());
        sortFields.removeAll(equalityFields);
        
        // Step 2: Equality prefix followed by the first remaining sort field
        List<String> prefix = new ArrayList<>(equalityFields);
        if (!sortFields.isEmpty()) {
            prefix.add(sortFields.get(0));
        }
        
        // Step 3: One candidate per choice of the trailing range field
        List<String> rangeChoices = !rangeFields.isEmpty() ? rangeFields : exclusionFields;
        if (rangeChoices.isEmpty()) {
            if (!prefix.isEmpty()) {
                sequences.add(prefix);
            }
        } else {
            for (String rangeField : rangeChoices) {
                List<String> sequence = new ArrayList<>(prefix);
                if (!sequence.contains(rangeField)) {
                    sequence.add(rangeField);
                }
                sequences.add(sequence);
            }
        }
        
        // Step 4: Single-field candidates
        for (String field : predicateFields) {
            sequences.add(List.of(field));
        }
        
        logger.debug("Shape {} yields field sequences {}", entry.getShape(), sequences);
        return new ArrayList<>(sequences);
    }
}
