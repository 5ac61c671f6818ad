package com.crowd.service.impl;

import com.crowd.exception.RecomputeChunkFailedException;
import com.crowd.geohash.GeohashCodec;
import com.crowd.model.DensityState;
import com.crowd.model.DensityTier;
import com.crowd.model.Signal;
import com.crowd.model.result.RecomputeResult;
import com.crowd.repository.DocumentStore;
import com.crowd.service.DensityAggregationService;
import com.crowd.service.DensityTierClassifier;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Flat-count density aggregation: every signal of a group gets the group's size and tier.
 *
 * A pass reads a snapshot of the group, classifies it once and commits the changed
 * signals in chunks no larger than the store's batch limit, one chunk at a time.
 * A chunk rejected by the store is logged and skipped. Either a mutation made it stale,
 * and that mutation schedules another pass for the same group, or a concurrent pass over
 * the same state committed first.
 */
@Service
public class DensityAggregationServiceImpl implements DensityAggregationService {
    
    private static final Logger logger = LoggerFactory.getLogger(DensityAggregationServiceImpl.class);
    
    private final DocumentStore<Signal> signalStore;
    private final DensityTierClassifier classifier;
    
    private final Counter passCounter;
    private final Counter chunkFailureCounter;
    
    public DensityAggregationServiceImpl(@Qualifier("signalStore") DocumentStore<Signal> signalStore,
                                         DensityTierClassifier classifier,
                                         MeterRegistry meterRegistry) {
        this.signalStore = signalStore;
        this.classifier = classifier;
        
        this.passCounter = Counter.builder("crowd.density.recompute.passes")
                .description("Number of density recompute passes")
                .register(meterRegistry);
        
        this.chunkFailureCounter = Counter.builder("crowd.density.recompute.chunk_failures")
                .description("Recompute batch chunks that could not be committed")
                .register(meterRegistry);
    }
    
    @Override
    public RecomputeResult recomputeCellGroup(String cell, int groupingPrecision) {
        if (groupingPrecision < GeohashCodec.MIN_PRECISION) {
            throw new IllegalArgumentException("Grouping precision must be positive, got " + groupingPrecision);
        }
        if (cell == null || cell.length() < groupingPrecision) {
            throw new IllegalArgumentException(String.format(
                "Cell '%s' is shorter than the grouping precision %d", cell, groupingPrecision));
        }
        
        long startTime = System.currentTimeMillis();
        String groupPrefix = cell.substring(0, groupingPrecision);
        passCounter.increment();
        
        List<Signal> members = scanGroup(groupPrefix);
        int peopleCount = members.size();
        DensityTier tier = classifier.classify(peopleCount);
        DensityState density = DensityState.of(peopleCount, tier);
        
        List<Signal> changed = new ArrayList<>();
        for (Signal signal : members) {
            if (!density.equals(signal.getDensity())) {
                signal.setDensity(density);
                changed.add(signal);
            }
        }
        
        int batchLimit = signalStore.maxBatchSize();
        int committed = 0;
        int failed = 0;
        int updated = 0;
        for (int from = 0, chunkIndex = 0; from < changed.size(); from += batchLimit, chunkIndex++) {
            List<Signal> chunk = changed.subList(from, Math.min(from + batchLimit, changed.size()));
            try {
                commitChunk(groupPrefix, chunkIndex, chunk);
                committed++;
                updated += chunk.size();
            } catch (RecomputeChunkFailedException e) {
                failed++;
                chunkFailureCounter.increment();
                logger.warn("Skipping chunk: {}", e.getMessage());
            }
        }
        
        logger.debug("Recomputed group {}: {} people, tier {}, {} signals updated in {} chunks ({} failed) in {}ms",
                    groupPrefix, peopleCount, tier, updated, committed, failed,
                    System.currentTimeMillis() - startTime);
        
        return RecomputeResult.builder()
                .groupPrefix(groupPrefix)
                .peopleCount(peopleCount)
                .tier(tier)
                .signalsUpdated(updated)
                .chunksCommitted(committed)
                .chunksFailed(failed)
                .build();
    }
    
    private List<Signal> scanGroup(String groupPrefix) {
        try {
            List<Signal> scanned = signalStore.rangeQuery(DocumentStore.CELL_FIELD, groupPrefix,
                                                          GeohashCodec.prefixUpperBound(groupPrefix)).join();
            // A signal moving inside the group during the scan can be read under both cells
            Map<String, Signal> members = new LinkedHashMap<>();
            for (Signal signal : scanned) {
                members.putIfAbsent(signal.getId(), signal);
            }
            return new ArrayList<>(members.values());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
    
    private void commitChunk(String groupPrefix, int chunkIndex, List<Signal> chunk) {
        try {
            signalStore.batchWrite(new ArrayList<>(chunk)).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new RecomputeChunkFailedException(groupPrefix, chunkIndex, chunk.size(), cause);
        }
    }
}
