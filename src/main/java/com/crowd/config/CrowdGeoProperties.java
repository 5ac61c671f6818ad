package com.crowd.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables of the proximity index and density engine, bound from {@code crowd.geo.*}
 */
@Data
@ConfigurationProperties(prefix = "crowd.geo")
public class CrowdGeoProperties {
    
    /**
     * Geohash length stored on every spatial entity
     */
    private int cellPrecision = 9;
    
    /**
     * Prefix length that defines a density group (5 characters is roughly 5 km)
     */
    private int groupingPrecision = 5;
    
    /**
     * Maximum entries per atomic batch write
     */
    private int maxBatchSize = 500;
    
    /**
     * Default deadline of a proximity query
     */
    private Duration queryTimeout = Duration.ofSeconds(5);
    
    /**
     * Threads serving store I/O
     */
    private int storeThreads = 8;
    
    /**
     * Worker threads draining the recompute queue
     */
    private int recomputeWorkers = 2;
}
