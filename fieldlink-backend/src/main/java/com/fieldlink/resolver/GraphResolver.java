package com.fieldlink.resolver;

import com.fieldlink.relation.LookupException;
import com.fieldlink.relation.RelationAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves every field value reachable from a set of seed values.
 *
 * <p>The traversal is a bounded breadth-first search over {@link LookupUnit}s. Each round freezes the
 * pending units into a worklist, runs their lookups concurrently on the shared executor and merges
 * the discoveries on the calling thread before the next round is assembled. Only the calling thread
 * touches the pending, visited and result sets.
 *
 * <p>A unit is looked up at most once per request. Values of non-distinct fields are reported but
 * never expanded. The traversal ends at a fixpoint or after {@code maxDepth} rounds; hitting the
 * bound still succeeds, with {@link #DEPTH_LIMIT_MESSAGE} and the values gathered so far.
 */
public class GraphResolver {
    private static final Logger log = LoggerFactory.getLogger(GraphResolver.class);

    public static final String DEPTH_LIMIT_MESSAGE = "depth length limit exceeded";
    public static final int DEFAULT_MAX_DEPTH = 10;

    private final FieldRelationIndex index;
    private final ExecutorService lookupExecutor;
    private final int maxDepth;
    private final long requestTimeoutMs;

    /**
     * Create a resolver.
     *
     * @param index field/relation routing
     * @param lookupExecutor pool running relation lookups, shared by all requests
     * @param maxDepth maximum number of rounds per request
     * @param requestTimeoutMs total time a request may wait for its lookups
     */
    public GraphResolver(FieldRelationIndex index, ExecutorService lookupExecutor, int maxDepth, long requestTimeoutMs) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1");
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException("requestTimeoutMs must be positive");
        }
        this.index = index;
        this.lookupExecutor = lookupExecutor;
        this.maxDepth = maxDepth;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    /**
     * Resolve the values linked to the given seeds.
     *
     * @param seeds known field values, field id to value
     * @return the discovered values, or a failure with no data
     */
    public ResolutionResult resolve(Map<String, String> seeds) {
        Set<LookupUnit> pending = new LinkedHashSet<>();
        // Seeds are used as lookup keys even when their field is not distinct.
        for (Map.Entry<String, String> seed : seeds.entrySet()) {
            List<RelationAdapter> relations = index.relationsFor(seed.getKey()).orElse(null);
            if (relations == null) {
                String message = "no relation has field `" + seed.getKey() + "`";
                log.warn("Resolution rejected: {}", message);
                return ResolutionResult.failure(message);
            }
            for (RelationAdapter relation : relations) {
                pending.add(new LookupUnit(relation.getName(), seed.getKey(), seed.getValue()));
            }
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(requestTimeoutMs);
        Set<LookupUnit> visited = new HashSet<>();
        Map<String, Set<String>> discovered = new HashMap<>();
        int rounds = 0;
        boolean depthLimitExceeded = false;

        try {
            while (!pending.isEmpty()) {
                if (rounds >= maxDepth) {
                    depthLimitExceeded = true;
                    break;
                }

                List<LookupUnit> worklist = new ArrayList<>();
                for (LookupUnit unit : pending) {
                    if (visited.add(unit)) {
                        worklist.add(unit);
                    }
                }
                pending = new LinkedHashSet<>();

                List<Map<String, Set<String>>> results = runRound(worklist, deadline);
                for (Map<String, Set<String>> result : results) {
                    merge(result, discovered, visited, pending);
                }
                rounds++;
                log.debug("Round {} done: {} lookups, {} units pending", rounds, worklist.size(), pending.size());
            }
        } catch (LookupException | UnknownFieldException | ResolutionAbortedException e) {
            log.warn("Resolution failed after {} rounds: {}", rounds, e.getMessage());
            return ResolutionResult.failure(e.getMessage());
        }

        SortedMap<String, List<String>> data = finish(discovered, seeds);
        if (depthLimitExceeded) {
            log.warn("Resolution stopped at depth limit {} with {} units pending", maxDepth, pending.size());
        }
        log.info("Resolution done: seeds={}, rounds={}, lookups={}, fields={}",
                seeds.keySet(), rounds, visited.size(), data.keySet());
        return ResolutionResult.success(depthLimitExceeded ? DEPTH_LIMIT_MESSAGE : "", data);
    }

    private List<Map<String, Set<String>>> runRound(List<LookupUnit> worklist, long deadline) {
        List<Future<Map<String, Set<String>>>> futures = new ArrayList<>(worklist.size());
        for (LookupUnit unit : worklist) {
            RelationAdapter relation = index.relation(unit.getRelation())
                    .orElseThrow(() -> new UnknownFieldException("unknown relation `" + unit.getRelation() + "`"));
            futures.add(lookupExecutor.submit(() -> lookup(relation, unit)));
        }

        List<Map<String, Set<String>>> results = new ArrayList<>(futures.size());
        try {
            for (Future<Map<String, Set<String>>> future : futures) {
                results.add(future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS));
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new LookupException("lookup failed: " + cause, cause);
        } catch (TimeoutException e) {
            cancelAll(futures);
            throw new ResolutionAbortedException("resolution timed out after " + requestTimeoutMs + " ms", e);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new ResolutionAbortedException("resolution interrupted", e);
        } catch (CancellationException e) {
            cancelAll(futures);
            throw new ResolutionAbortedException("resolution cancelled", e);
        }
        return results;
    }

    private Map<String, Set<String>> lookup(RelationAdapter relation, LookupUnit unit) {
        log.debug("visit: {}", unit);
        try {
            return relation.lookup(unit.getFieldId(), unit.getValue());
        } catch (RuntimeException e) {
            throw new LookupException(String.format("failed to query relation `%s` with field `%s`, value `%s`: %s",
                    unit.getRelation(), unit.getFieldId(), unit.getValue(), e.getMessage()), e);
        }
    }

    private void merge(Map<String, Set<String>> result, Map<String, Set<String>> discovered,
                       Set<LookupUnit> visited, Set<LookupUnit> pending) {
        for (Map.Entry<String, Set<String>> entry : result.entrySet()) {
            String fieldId = entry.getKey();
            discovered.computeIfAbsent(fieldId, k -> new HashSet<>()).addAll(entry.getValue());

            // Non-distinct fields are terminal to keep low-cardinality attributes from fanning out.
            if (!index.isDistinct(fieldId)) {
                continue;
            }
            List<RelationAdapter> relations = index.relationsFor(fieldId).orElse(List.of());
            for (String value : entry.getValue()) {
                for (RelationAdapter relation : relations) {
                    LookupUnit next = new LookupUnit(relation.getName(), fieldId, value);
                    if (!visited.contains(next)) {
                        pending.add(next);
                    }
                }
            }
        }
    }

    private static SortedMap<String, List<String>> finish(Map<String, Set<String>> discovered, Map<String, String> seeds) {
        SortedMap<String, List<String>> data = new TreeMap<>();
        for (Map.Entry<String, Set<String>> entry : discovered.entrySet()) {
            TreeSet<String> values = new TreeSet<>(entry.getValue());
            String seedValue = seeds.get(entry.getKey());
            if (seedValue != null) {
                values.remove(seedValue);
            }
            if (!values.isEmpty()) {
                data.put(entry.getKey(), List.copyOf(values));
            }
        }
        return data;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }
}
