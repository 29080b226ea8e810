package com.fsnow.indexadvisor;

import com.fsnow.indexadvisor.candidate.CandidateGenerator;
import com.fsnow.indexadvisor.config.AdvisorConfig;
import com.fsnow.indexadvisor.estimation.EstimationReport;
import com.fsnow.indexadvisor.estimation.SampleSource;
import com.fsnow.indexadvisor.estimation.SelectivityEstimator;
import com.fsnow.indexadvisor.exception.AdvisorCancelledException;
import com.fsnow.indexadvisor.exception.SourceUnavailableException;
import com.fsnow.indexadvisor.model.IndexCandidate;
import com.fsnow.indexadvisor.model.Query;
import com.fsnow.indexadvisor.model.RawQuery;
import com.fsnow.indexadvisor.model.WorkloadEntry;
import com.fsnow.indexadvisor.output.ResultSink;
import com.fsnow.indexadvisor.parser.QueryNormalizer;
import com.fsnow.indexadvisor.scoring.CandidateRanker;
import com.fsnow.indexadvisor.workload.WorkloadAggregator;
import com.fsnow.indexadvisor.workload.WorkloadSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the index advisory pipeline over explicit collaborators:
 * normalize → aggregate → generate → estimate → rank.
 * <p>
 * A single bad query or a single failed estimate never aborts a run. A workload or sample source
 * that cannot be reached does, as does cancellation; no partial recommendation list is produced then.
 */
public class IndexAdvisorEngine {

    private static final Logger logger = LoggerFactory.getLogger(IndexAdvisorEngine.class);

    private final AdvisorConfig config;
    private final QueryNormalizer normalizer;
    private final CandidateGenerator generator;
    private final SelectivityEstimator estimator;
    private final CandidateRanker ranker;

    public IndexAdvisorEngine(AdvisorConfig config) {
        this.config = config;
        this.normalizer = new QueryNormalizer(config.getInCardinalityThreshold());
        this.generator = new CandidateGenerator();
        this.estimator = new SelectivityEstimator(config.getConcurrency(), config.getEstimationTimeoutMs());
        this.ranker = new CandidateRanker(config.getSelectivityExponent());
    }

    /**
     * Produces the ranked recommendations for a namespace and hands them to the sink.
     */
    public AdvisorResult recommend(String namespace, WorkloadSource workloadSource,
                                   SampleSource sampleSource, ResultSink resultSink) {
        AdvisorResult result = recommend(namespace, workloadSource, sampleSource);
        resultSink.publish(result.getRecommendations());
        return result;
    }

    /**
     * Produces the ranked recommendations for a namespace.
     *
     * @throws SourceUnavailableException if the workload or the sample cannot be read
     * @throws AdvisorCancelledException if the calling thread is interrupted or estimation times out
     */
    public AdvisorResult recommend(String namespace, WorkloadSource workloadSource, SampleSource sampleSource) {
        logger.info("Starting index advisory run for namespace: {}", namespace);

        WorkloadAggregator aggregator = new WorkloadAggregator(config.getMaxRepresentatives());
        Map<String, Integer> skipReasons = new LinkedHashMap<>();
        long totalQueries = 0;

        Iterator<RawQuery> workload = openWorkload(namespace, workloadSource);
        while (hasNext(namespace, workload)) {
            RawQuery raw = next(namespace, workload);
            checkCancelled();
            totalQueries++;

            Query query = normalizer.normalize(raw);
            if (query.isSupported()) {
                aggregator.add(query);
            } else {
                skipReasons.merge(query.getUnsupportedReason(), 1, Integer::sum);
            }
        }

        long skipped = totalQueries - aggregator.getQueryCount();
        if (skipped > 0) {
            logger.warn("Skipped {} of {} queries with unsupported shapes", skipped, totalQueries);
        }

        List<WorkloadEntry> entries = aggregator.getEntries();
        logger.info("Workload: {} queries, {} supported, {} distinct shapes",
                totalQueries, aggregator.getQueryCount(), entries.size());

        List<IndexCandidate> candidates = generator.generate(entries);
        checkCancelled();

        EstimationReport report = estimator.estimate(candidates, sampleSource);
        if (report.isEmptySample()) {
            logger.warn("Sample for {} is empty, recommendations are ranked by workload frequency only", namespace);
        }

        List<IndexCandidate> ranked = ranker.rank(candidates);

        AdvisorResult result = new AdvisorResult.Builder()
                .recommendations(ranked)
                .totalQueries(totalQueries)
                .supportedQueries(aggregator.getQueryCount())
                .skipReasons(skipReasons)
                .workloadEntries(entries.size())
                .candidatesGenerated(candidates.size())
                .sampleSize(report.getSampleSize())
                .unknownEstimates(report.getUnknownEstimates())
                .build();

        logger.info("Index advisory run finished: {}", result);
        return result;
    }

    private Iterator<RawQuery> openWorkload(String namespace, WorkloadSource workloadSource) {
        try {
            return workloadSource.queries(namespace).iterator();
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("Failed to open workload for namespace: " + namespace, e);
        }
    }

    private boolean hasNext(String namespace, Iterator<RawQuery> workload) {
        try {
            return workload.hasNext();
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("Failed to read workload for namespace: " + namespace, e);
        }
    }

    private RawQuery next(String namespace, Iterator<RawQuery> workload) {
        try {
            return workload.next();
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("Failed to read workload for namespace: " + namespace, e);
        }
    }

    private void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new AdvisorCancelledException("Index advisory run was interrupted");
        }
    }
}
