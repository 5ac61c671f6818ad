package com.crowd.service;

import com.crowd.model.result.RecomputeResult;

/**
 * Recomputes the density of every signal sharing a cell group
 */
public interface DensityAggregationService {
    
    /**
     * Recompute the group holding the given cell. The pass is idempotent: running it
     * twice with no intervening mutation writes the same values.
     *
     * Chunk failures are logged and reported in the result, never thrown.
     *
     * @param cell any cell of the group, at least {@code groupingPrecision} characters
     * @param groupingPrecision length of the group prefix
     */
    RecomputeResult recomputeCellGroup(String cell, int groupingPrecision);
}
