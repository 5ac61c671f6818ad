package com.crowd.service.impl;

import com.crowd.config.CrowdGeoProperties;
import com.crowd.exception.ProximityQueryFailedException;
import com.crowd.exception.ProximityQueryTimedOutException;
import com.crowd.geohash.DistanceCalculator;
import com.crowd.geohash.GeohashCodec;
import com.crowd.geohash.RangePlanner;
import com.crowd.model.GeoPoint;
import com.crowd.model.SearchResult;
import com.crowd.model.base.BaseSpatialEntity;
import com.crowd.model.param.ProximityQuery;
import com.crowd.repository.DocumentStore;
import com.crowd.service.ProximitySearchService;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Proximity search that fans out one range scan per covering prefix and merges the hits
 */
@Service
public class ProximitySearchServiceImpl implements ProximitySearchService {
    
    private static final Logger logger = LoggerFactory.getLogger(ProximitySearchServiceImpl.class);
    
    private final CrowdGeoProperties properties;
    
    private final Counter queryCounter;
    private final Counter failureCounter;
    private final Counter timeoutCounter;
    private final Timer queryTimer;
    
    public ProximitySearchServiceImpl(CrowdGeoProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;
        
        this.queryCounter = Counter.builder("crowd.proximity.queries")
                .description("Number of proximity queries")
                .register(meterRegistry);
        
        this.failureCounter = Counter.builder("crowd.proximity.failures")
                .description("Proximity queries failed by a prefix scan")
                .register(meterRegistry);
        
        this.timeoutCounter = Counter.builder("crowd.proximity.timeouts")
                .description("Proximity queries that exceeded their deadline")
                .register(meterRegistry);
        
        this.queryTimer = Timer.builder("crowd.proximity.duration")
                .description("Proximity query execution time")
                .register(meterRegistry);
    }
    
    @Override
    public <T extends BaseSpatialEntity<String>> List<SearchResult<T>> findNear(DocumentStore<T> store, ProximityQuery query) {
        if (query == null || !query.isValid()) {
            throw new IllegalArgumentException("Invalid proximity query: " + query);
        }
        Duration timeout = query.getTimeout() != null ? query.getTimeout() : properties.getQueryTimeout();
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Query timeout must be positive, got " + timeout);
        }
        
        queryCounter.increment();
        Timer.Sample sample = Timer.start();
        long startTime = System.currentTimeMillis();
        
        GeoPoint origin = query.getOrigin();
        Set<String> prefixes = RangePlanner.cellsCovering(origin, query.getRadiusKm());
        
        List<CompletableFuture<List<T>>> scans = new ArrayList<>(prefixes.size());
        for (String prefix : prefixes) {
            scans.add(store.rangeQuery(DocumentStore.CELL_FIELD, prefix, GeohashCodec.prefixUpperBound(prefix)));
        }
        
        try {
            awaitAll(scans, timeout, store.name());
        } finally {
            sample.stop(queryTimer);
        }
        
        // A document that moved between two scans can surface in both
        Map<String, T> candidates = new LinkedHashMap<>();
        for (CompletableFuture<List<T>> scan : scans) {
            for (T entity : scan.join()) {
                candidates.putIfAbsent(entity.getId(), entity);
            }
        }
        
        List<SearchResult<T>> results = new ArrayList<>();
        for (T entity : candidates.values()) {
            if (entity.getLocation() == null) {
                continue;
            }
            double distance = DistanceCalculator.distanceKm(origin, entity.getLocation());
            if (distance <= query.getRadiusKm()) {
                results.add(SearchResult.<T>builder()
                        .id(entity.getId())
                        .entity(entity)
                        .distanceKm(distance)
                        .build());
            }
        }
        results.sort(Comparator.comparingDouble(SearchResult::getDistanceKm));
        
        logger.debug("Proximity query on {} around ({}, {}) r={}km scanned {} prefixes, {} candidates, {} hits in {}ms",
                    store.name(), origin.getLatitude(), origin.getLongitude(), query.getRadiusKm(),
                    prefixes.size(), candidates.size(), results.size(), System.currentTimeMillis() - startTime);
        return results;
    }
    
    private <T> void awaitAll(List<CompletableFuture<List<T>>> scans, Duration timeout, String storeName) {
        CompletableFuture<Void> all = CompletableFuture.allOf(scans.toArray(new CompletableFuture[0]));
        try {
            all.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            scans.forEach(scan -> scan.cancel(true));
            timeoutCounter.increment();
            logger.warn("Proximity query on {} timed out after {}ms", storeName, timeout.toMillis());
            throw new ProximityQueryTimedOutException(timeout, e);
        } catch (ExecutionException e) {
            scans.forEach(scan -> scan.cancel(true));
            failureCounter.increment();
            logger.warn("Prefix scan on {} failed: {}", storeName, e.getCause().getMessage());
            throw new ProximityQueryFailedException("Prefix scan on " + storeName + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scans.forEach(scan -> scan.cancel(true));
            failureCounter.increment();
            throw new ProximityQueryFailedException("Proximity query on " + storeName + " was interrupted", e);
        }
    }
}
