package com.fsnow.indexadvisor.estimation;

import com.fsnow.indexadvisor.exception.AdvisorCancelledException;
import com.fsnow.indexadvisor.exception.SourceUnavailableException;
import com.fsnow.indexadvisor.model.IndexCandidate;
import com.fsnow.indexadvisor.model.Operator;
import com.fsnow.indexadvisor.model.Predicate;
import com.fsnow.indexadvisor.model.Query;
import com.fsnow.indexadvisor.model.SampleStatistics;
import com.fsnow.indexadvisor.model.WorkloadEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Estimates how well each candidate's prefixes narrow the data sample.
 * <p>
 * Every distinct sampling query is submitted once to a bounded worker pool; each result lives
 * in its own future. Once all futures are collected, a single-threaded merge turns them into
 * {@link SampleStatistics} and attaches them to the candidates. If the run is interrupted, times
 * out or loses the sample, no candidate is touched.
 * <p>
 * Selectivity at a prefix is the largest match count over the operand bindings of all
 * representative queries, divided by the sample size. A field missing from every sampled
 * document, or a count that failed, gives the worst case of 1.0.
 */
public class SelectivityEstimator {

    private static final Logger logger = LoggerFactory.getLogger(SelectivityEstimator.class);

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final int concurrency;
    private final long timeoutMs;

    public SelectivityEstimator(int concurrency, long timeoutMs) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("Concurrency must be positive");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        this.concurrency = concurrency;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Populates the statistics and selectivity of every candidate.
     *
     * @throws SourceUnavailableException if the sample cannot be reached at all
     * @throws AdvisorCancelledException if the calling thread is interrupted or the timeout elapses
     */
    public EstimationReport estimate(List<IndexCandidate> candidates, SampleSource sampleSource) {
        long sampleSize = readSampleSize(sampleSource);

        if (sampleSize == 0) {
            logger.warn("Sample is empty, every candidate gets the worst-case selectivity");
            for (IndexCandidate candidate : candidates) {
                candidate.applyStatistics(new SampleStatistics(0, new long[candidate.size()]));
            }
            return new EstimationReport(0, 0, 0);
        }

        // Plan: the distinct bound filters of every candidate prefix
        Map<IndexCandidate, List<Set<List<Predicate>>>> plan = new LinkedHashMap<>();
        Set<String> fields = new LinkedHashSet<>();
        Set<List<Predicate>> filters = new LinkedHashSet<>();
        for (IndexCandidate candidate : candidates) {
            List<Set<List<Predicate>>> prefixes = planPrefixes(candidate);
            plan.put(candidate, prefixes);
            fields.addAll(candidate.getFields());
            for (Set<List<Predicate>> prefixFilters : prefixes) {
                for (List<Predicate> filter : prefixFilters) {
                    if (!filter.isEmpty()) {
                        filters.add(filter);
                    }
                }
            }
        }

        logger.info("Estimating {} candidates with {} field probes and {} sampling queries (concurrency={})",
                candidates.size(), fields.size(), filters.size(), concurrency);

        Map<String, Long> presence;
        Map<List<Predicate>, Long> matchCounts;
        ExecutorService pool = Executors.newFixedThreadPool(concurrency, threadFactory());
        try {
            Map<String, Future<Long>> presenceFutures = new LinkedHashMap<>();
            for (String field : fields) {
                List<Predicate> probe = List.of(new Predicate(field, Operator.EXISTS, true));
                presenceFutures.put(field, pool.submit(() -> sampleSource.countMatching(probe)));
            }

            Map<List<Predicate>, Future<Long>> countFutures = new LinkedHashMap<>();
            for (List<Predicate> filter : filters) {
                countFutures.put(filter, pool.submit(() -> sampleSource.countMatching(filter)));
            }

            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            List<Future<Long>> all = new ArrayList<>(presenceFutures.values());
            all.addAll(countFutures.values());
            try {
                presence = collect(presenceFutures, deadline);
                matchCounts = collect(countFutures, deadline);
            } catch (RuntimeException e) {
                all.forEach(f -> f.cancel(true));
                throw e;
            }
        } finally {
            pool.shutdownNow();
        }

        // Merge
        int unknownEstimates = 0;
        for (Map.Entry<IndexCandidate, List<Set<List<Predicate>>>> entry : plan.entrySet()) {
            IndexCandidate candidate = entry.getKey();
            SampleStatistics statistics = mergeCandidate(candidate, entry.getValue(), sampleSize, presence, matchCounts);
            unknownEstimates += statistics.getUnknownCount();
            candidate.applyStatistics(statistics);
            logger.debug("Estimated {} -> {}", candidate.getFields(), statistics);
        }

        EstimationReport report = new EstimationReport(sampleSize, fields.size() + filters.size(), unknownEstimates);
        logger.info("Estimation finished: {}", report);
        return report;
    }

    private long readSampleSize(SampleSource sampleSource) {
        try {
            long size = sampleSource.count();
            if (size < 0) {
                throw new SourceUnavailableException("Sample reported a negative size: " + size);
            }
            return size;
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("Failed to read the sample size", e);
        }
    }

    /**
     * For each prefix length, the distinct predicate lists bound from the representatives
     * of all contributing entries.
     */
    private List<Set<List<Predicate>>> planPrefixes(IndexCandidate candidate) {
        List<Set<List<Predicate>>> prefixes = new ArrayList<>();
        for (int length = 1; length <= candidate.size(); length++) {
            List<String> prefixFields = candidate.getFields().subList(0, length);
            Set<List<Predicate>> bound = new LinkedHashSet<>();
            for (WorkloadEntry entry : candidate.getContributingEntries()) {
                for (Query representative : entry.getRepresentatives()) {
                    bound.add(bind(representative, prefixFields));
                }
            }
            if (bound.isEmpty()) {
                bound.add(List.of());
            }
            prefixes.add(bound);
        }
        return prefixes;
    }

    private List<Predicate> bind(Query query, List<String> fields) {
        List<Predicate> predicates = new ArrayList<>();
        for (String field : fields) {
            query.getPredicate(field).ifPresent(predicates::add);
        }
        return predicates;
    }

    private SampleStatistics mergeCandidate(IndexCandidate candidate,
                                            List<Set<List<Predicate>>> prefixes,
                                            long sampleSize,
                                            Map<String, Long> presence,
                                            Map<List<Predicate>, Long> matchCounts) {
        long[] counts = new long[candidate.size()];
        boolean absentFieldSeen = false;

        for (int i = 0; i < counts.length; i++) {
            Long present = presence.get(candidate.getFields().get(i));
            if (present == null || present == SampleStatistics.UNKNOWN || present == 0) {
                absentFieldSeen = true;
            }
            if (absentFieldSeen) {
                counts[i] = SampleStatistics.UNKNOWN;
                continue;
            }

            // Most conservative binding wins
            long max = 0;
            for (List<Predicate> filter : prefixes.get(i)) {
                long matches = filter.isEmpty() ? sampleSize : matchCounts.get(filter);
                if (matches == SampleStatistics.UNKNOWN) {
                    max = SampleStatistics.UNKNOWN;
                    break;
                }
                max = Math.max(max, matches);
            }
            counts[i] = max;
        }

        return new SampleStatistics(sampleSize, counts);
    }

    private <K> Map<K, Long> collect(Map<K, Future<Long>> futures, long deadline) {
        Map<K, Long> results = new LinkedHashMap<>();
        for (Map.Entry<K, Future<Long>> entry : futures.entrySet()) {
            results.put(entry.getKey(), await(entry.getKey(), entry.getValue(), deadline));
        }
        return results;
    }

    private long await(Object key, Future<Long> future, long deadline) {
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdvisorCancelledException("Estimation was interrupted", e);
        } catch (TimeoutException e) {
            throw new AdvisorCancelledException(String.format("Estimation exceeded its timeout of %d ms", timeoutMs), e);
        } catch (CancellationException e) {
            throw new AdvisorCancelledException("Estimation task was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SourceUnavailableException) {
                logger.error("Sample became unavailable during estimation", cause);
                throw (SourceUnavailableException) cause;
            }
            logger.debug("Sampling query {} failed, using worst case: {}", key, String.valueOf(cause));
            return SampleStatistics.UNKNOWN;
        }
    }

    private static ThreadFactory threadFactory() {
        int poolId = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, "SelectivityEstimator-" + poolId + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
