package com.fsnow.indexadvisor.output;

import com.fsnow.indexadvisor.model.IndexCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Writes recommendations to the application log, one line per index.
 */
public class LoggingResultSink implements ResultSink {
    
    private static final Logger logger = LoggerFactory.getLogger(LoggingResultSink.class);
    
    @Override
    public void publish(List<IndexCandidate> recommendations) {
        if (recommendations.isEmpty()) {
            logger.info("No index recommendations");
            return;
        }
        
        logger.info("{} index recommendations:", recommendations.size());
        int rank = 1;
        for (IndexCandidate candidate : recommendations) {
            logger.info(format(rank++, candidate));
        }
    }
    
    /**
     * Formats one recommendation line, e.g.
     * {@code #1 {"name": 1} score=9.990 selectivity=0.0010 queries=10}
     */
    static String format(int rank, IndexCandidate candidate) {
        return String.format(Locale.ROOT, "#%d %s score=%.3f selectivity=%.4f queries=%d",
                rank, candidate.indexKeys().toJson(), candidate.getScore(),
                candidate.getSelectivity(), candidate.totalFrequency());
    }
}
