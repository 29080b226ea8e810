package com.fsnow.indexadvisor.scoring;

import com.fsnow.indexadvisor.model.IndexCandidate;
import com.fsnow.indexadvisor.model.WorkloadEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores estimated candidates, removes redundant ones and orders the rest.
 * <p>
 * Score: {@code Σ entry.frequency × (1 − selectivity)^exponent} over the contributing entries.
 * A candidate whose fields are a strict prefix of another candidate with an equal or higher
 * score is redundant and dropped.
 */
public class CandidateRanker {
    
    private static final Logger logger = LoggerFactory.getLogger(CandidateRanker.class);
    
    /**
     * Score descending, then workload weight descending, then fewer fields, then field order.
     */
    public static final Comparator<IndexCandidate> RANKING_ORDER = Comparator
            .comparingDouble(IndexCandidate::getScore).reversed()
            .thenComparing(Comparator.comparingLong(IndexCandidate::totalFrequency).reversed())
            .thenComparingInt(IndexCandidate::size)
            .thenComparing(IndexCandidate::getFields, CandidateRanker::compareFields);
    
    private final double selectivityExponent;
    
    public CandidateRanker(double selectivityExponent) {
        if (!(selectivityExponent > 0) || Double.isInfinite(selectivityExponent)) {
            throw new IllegalArgumentException("Selectivity exponent must be a positive number");
        }
        this.selectivityExponent = selectivityExponent;
    }
    
    /**
     * Computes the score of one candidate from its selectivity and contributing entries.
     */
    public double score(IndexCandidate candidate) {
        double benefit = Math.pow(1.0 - candidate.getSelectivity(), selectivityExponent);
        double score = 0;
        for (WorkloadEntry entry : candidate.getContributingEntries()) {
            score += entry.getFrequency() * benefit;
        }
        return score;
    }
    
    /**
     * Scores all candidates and returns the non-redundant ones in ranking order.
     */
    public List<IndexCandidate> rank(List<IndexCandidate> candidates) {
        for (IndexCandidate candidate : candidates) {
            candidate.setScore(score(candidate));
        }
        
        List<IndexCandidate> ranked = pruneRedundant(candidates);
        ranked.sort(RANKING_ORDER);
        
        logger.info("Ranked {} candidates ({} redundant dropped)", ranked.size(), candidates.size() - ranked.size());
        return ranked;
    }
    
    private List<IndexCandidate> pruneRedundant(List<IndexCandidate> candidates) {
        List<IndexCandidate> kept = new ArrayList<>();
        for (IndexCandidate candidate : candidates) {
            IndexCandidate subsumer = null;
            for (IndexCandidate other : candidates) {
                if (candidate.isStrictPrefixOf(other) && other.getScore() >= candidate.getScore()) {
                    subsumer = other;
                    break;
                }
            }
            if (subsumer == null) {
                kept.add(candidate);
            } else {
                logger.debug("Dropping {}: served by {}", candidate.getFields(), subsumer.getFields());
            }
        }
        return kept;
    }
    
    private static int compareFields(List<String> a, List<String> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
